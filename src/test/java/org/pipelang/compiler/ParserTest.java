/*
 * Copyright 2025 The Pipelang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pipelang.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pipelang.compiler.Ast.PipeMode;
import org.pipelang.compiler.CompileError.Kind;

@RunWith(JUnitParamsRunner.class)
public class ParserTest {

  private static Ast.Node parseMain(String source) {
    return Compiler.parse(source).main();
  }

  @Test
  public void simplePipe() {
    Ast.Node main = parseMain("webcam -> display");
    assertThat(main)
        .isEqualTo(
            new Ast.Pipe(
                new Ast.PipelineRef("webcam"), new Ast.PipelineRef("display"), PipeMode.SYNC));
    assertThat(main.toString()).isEqualTo("Pipeline(PipelineRef(webcam) -> PipelineRef(display))");
  }

  @Test
  public void functionWithParameters() {
    Ast.Node main = parseMain("blur with (kernel_size: 5, sigma: 2.0)");
    assertThat(main)
        .isEqualTo(new Ast.Function("blur", ImmutableMap.of("kernel_size", 5L, "sigma", 2.0)));
    assertThat(main.toString()).isEqualTo("Function(blur, params={kernel_size=5, sigma=2.0})");
  }

  @Test
  public void parametersWithoutWith() {
    assertThat(parseMain("blur(kernel_size: 5)"))
        .isEqualTo(new Ast.Function("blur", ImmutableMap.of("kernel_size", 5L)));
  }

  @Test
  public void emptyParameters() {
    assertThat(parseMain("gray with")).isEqualTo(new Ast.Function("gray", ImmutableMap.of()));
    assertThat(parseMain("gray()")).isEqualTo(new Ast.Function("gray", ImmutableMap.of()));
    assertThat(parseMain("gray with ()").toString()).isEqualTo("Function(gray)");
  }

  @Test
  public void positionalAndNamedParameters() {
    Ast.Node main = parseMain("f(1, 'x', mode: fast,)");
    assertThat(((Ast.Function) main).params())
        .containsExactly("arg0", 1L, "arg1", "x", "mode", "fast")
        .inOrder();
    assertThat(main.toString())
        .isEqualTo("Function(f, params={arg0=1, arg1=\"x\", mode=\"fast\"})");
  }

  @Test
  public void repeatedKeyKeepsLastValue() {
    assertThat(((Ast.Function) parseMain("f(a: 1, b: 2, a: 3)")).params())
        .containsExactly("a", 3L, "b", 2L)
        .inOrder();
  }

  @Test
  public void pipesAreLeftAssociative() {
    Ast.Node main = parseMain("a -> b ~> c => d");
    assertThat(main.toString())
        .isEqualTo(
            "Pipeline(Pipeline(Pipeline(PipelineRef(a) -> PipelineRef(b)) ~> PipelineRef(c))"
                + " => PipelineRef(d))");
    assertThat(((Ast.Pipe) main).mode()).isEqualTo(PipeMode.BLOCKING);
  }

  @Test
  public void pipeBindsTighterThanParallel() {
    assertThat(parseMain("a -> b &> c -> d &> e").toString())
        .isEqualTo(
            "Parallel(Pipeline(PipelineRef(a) -> PipelineRef(b))"
                + " &> Pipeline(PipelineRef(c) -> PipelineRef(d)) &> PipelineRef(e))");
  }

  @Test
  public void precedence() {
    assertThat(parseMain("a &> b | c +> d").toString())
        .isEqualTo(
            "Merge([Choice(Parallel(PipelineRef(a) &> PipelineRef(b)) | PipelineRef(c))]"
                + " +> PipelineRef(d))");
  }

  @Test
  public void choice() {
    Ast.Node main = parseMain("a | b | c");
    assertThat(main)
        .isEqualTo(
            new Ast.Choice(
                ImmutableList.of(
                    new Ast.PipelineRef("a"),
                    new Ast.PipelineRef("b"),
                    new Ast.PipelineRef("c"))));
  }

  @Test
  public void groupsAndLoops() {
    assertThat(parseMain("{ a -> b } -> (c &> d)").toString())
        .isEqualTo(
            "Pipeline(Loop({Pipeline(PipelineRef(a) -> PipelineRef(b))})"
                + " -> Group(Parallel(PipelineRef(c) &> PipelineRef(d))))");
  }

  @Test
  public void groupOverridesPrecedence() {
    assertThat(parseMain("a -> (b &> c) -> d").toString())
        .isEqualTo(
            "Pipeline(Pipeline(PipelineRef(a) -> Group(Parallel(PipelineRef(b) &> PipelineRef(c))))"
                + " -> PipelineRef(d))");
  }

  @Test
  public void timed() {
    assertThat(parseMain("camera @ 5s -> display").toString())
        .isEqualTo("Pipeline(Timed(PipelineRef(camera) @ 5.0s) -> PipelineRef(display))");
    assertThat(parseMain("blur(sigma: 1) @ 2.5"))
        .isEqualTo(
            new Ast.TimedPipe(new Ast.Function("blur", ImmutableMap.of("sigma", 1L)), 2.5));
  }

  @Test
  public void bufferedPipeKeepsOnlyItsTarget() {
    assertThat(parseMain("a -> [5]-> b"))
        .isEqualTo(
            new Ast.Pipe(new Ast.PipelineRef("a"), new Ast.PipelineRef("b"), PipeMode.SYNC));
    assertThat(parseMain("[3]-> b")).isEqualTo(new Ast.PipelineRef("b"));
  }

  @Test
  public void definitions() {
    Ast.Program program = Compiler.parse("pipeline p = a -> b\npipeline q = c\np -> q");
    assertThat(program.definitions()).hasSize(2);
    assertThat(program.definitions().get(1))
        .isEqualTo(new Ast.PipelineDef("q", new Ast.PipelineRef("c")));
    assertThat(program.toString())
        .isEqualTo(
            "Program([PipelineDef(p = Pipeline(PipelineRef(a) -> PipelineRef(b))),"
                + " PipelineDef(q = PipelineRef(c))],"
                + " main=Pipeline(PipelineRef(p) -> PipelineRef(q)))");
  }

  @Test
  public void definitionsOnly() {
    Ast.Program program = Compiler.parse("pipeline p = a");
    assertThat(program.main()).isNull();
    assertThat(program.toString()).isEqualTo("Program([PipelineDef(p = PipelineRef(a))])");
  }

  @Test
  public void emptyProgram() {
    Ast.Program program = Compiler.parse("  # nothing here\n");
    assertThat(program.definitions()).isEmpty();
    assertThat(program.main()).isNull();
  }

  @Test
  public void mainOnly() {
    assertThat(Compiler.parse("a").toString()).isEqualTo("Program(PipelineRef(a))");
  }

  @Test
  public void parsingIsDeterministic() {
    String source =
        "pipeline fx = blur with (kernel_size: 5) -> edges\n"
            + "camera(device: 0) @ 10s -> { fx } -> (display &> record('out.mp4')) | log +> sink";
    assertThat(Compiler.parse(source)).isEqualTo(Compiler.parse(source));
    assertThat(Compiler.parse(source).toString()).isEqualTo(Compiler.parse(source).toString());
  }

  @Test
  public void tokenListMustEndWithEof() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Parser.parse(ImmutableList.of(new Token(TokenType.IDENTIFIER, "a", 1, 1))));
  }

  private static Object[] errors() {
    return new Object[][] {
      {"pipeline = a", Kind.EXPECTED_TOKEN},
      {"pipeline p a", Kind.EXPECTED_TOKEN},
      {"pipeline p =", Kind.EXPECTED_EXPRESSION},
      {"a ->", Kind.EXPECTED_EXPRESSION},
      {"a &>", Kind.EXPECTED_EXPRESSION},
      {"a |", Kind.EXPECTED_EXPRESSION},
      {"a +>", Kind.EXPECTED_EXPRESSION},
      {"a +> b +> c", Kind.TRAILING_INPUT},
      {"a b", Kind.TRAILING_INPUT},
      {")", Kind.TRAILING_INPUT},
      {"(a", Kind.EXPECTED_TOKEN},
      {"()", Kind.EXPECTED_EXPRESSION},
      {"{}", Kind.EXPECTED_EXPRESSION},
      {"{a", Kind.EXPECTED_TOKEN},
      {"f(x: )", Kind.EXPECTED_VALUE},
      {"f(=)", Kind.EXPECTED_VALUE},
      {"f(1 2)", Kind.EXPECTED_TOKEN},
      {"f(1", Kind.EXPECTED_TOKEN},
      {"a @ s", Kind.EXPECTED_TOKEN},
      {"[x]-> a", Kind.EXPECTED_TOKEN},
      {"[5] a", Kind.EXPECTED_TOKEN},
      {"[5]->", Kind.EXPECTED_EXPRESSION},
    };
  }

  @Test
  @Parameters(method = "errors")
  public void parseErrors(String source, Kind kind) {
    ParseError e = assertThrows(ParseError.class, () -> Compiler.parse(source));
    assertThat(e.kind).isEqualTo(kind);
    assertThat(e.hasPosition()).isTrue();
  }

  @Test
  public void errorPosition() {
    ParseError e = assertThrows(ParseError.class, () -> Compiler.parse("a ->\n  b c"));
    assertThat(e.kind).isEqualTo(Kind.TRAILING_INPUT);
    assertThat(e.lineNum).isEqualTo(2);
    assertThat(e.charPositionInLine).isEqualTo(5);
    assertThat(e).hasMessageThat().isEqualTo("Unexpected token: c (2:5)");
  }

  @Test
  public void lexErrorsPassThroughParse() {
    LexError e = assertThrows(LexError.class, () -> Compiler.parse("a -> 'abc"));
    assertThat(e.kind).isEqualTo(Kind.UNTERMINATED_STRING);
  }
}

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
package org.pipelang.tools;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InspectTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private PrintStream savedOut;

  @Before
  public void captureOutput() {
    savedOut = System.out;
    System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
  }

  @After
  public void restore() {
    System.setOut(savedOut);
    System.clearProperty("mode");
  }

  private String inspect(String source) throws Exception {
    File file = tmp.newFile("program.pipe");
    Files.writeString(file.toPath(), source);
    Inspect.main(new String[] {file.getPath()});
    return out.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void printsProgram() throws Exception {
    String output = inspect("pipeline fx = blur(sigma: 2)\ncamera -> fx");
    assertThat(output)
        .isEqualTo(
            "PipelineDef(fx = Function(blur, params={sigma=2}))\n"
                + "Pipeline(PipelineRef(camera) -> PipelineRef(fx))\n");
  }

  @Test
  public void printsTokens() throws Exception {
    System.setProperty("mode", "tokens");
    String output = inspect("a -> b");
    assertThat(output.split("\n"))
        .asList()
        .containsExactly(
            "Token(IDENTIFIER, a, 1,1)",
            "Token(SYNC_PIPE, ->, 1,3)",
            "Token(IDENTIFIER, b, 1,6)",
            "Token(EOF, null, 1,7)")
        .inOrder();
  }
}

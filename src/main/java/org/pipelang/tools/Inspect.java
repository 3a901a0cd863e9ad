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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.pipelang.compiler.Ast;
import org.pipelang.compiler.CompileError;
import org.pipelang.compiler.Compiler;
import org.pipelang.compiler.Token;

/**
 * A simple command-line tool that prints the tokens ({@code -Dmode=tokens}) or the parsed program
 * ({@code -Dmode=ast}, the default) of a pipelang source file.
 */
public class Inspect {
  private Inspect() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: [-Dmode=tokens|ast] inspect <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    String mode = System.getProperty("mode", "ast");
    checkUsage(args.length == 1 && (mode.equals("tokens") || mode.equals("ast")));
    String source = Files.readString(Path.of(args[0]));
    try {
      if (mode.equals("tokens")) {
        for (Token token : Compiler.tokenize(source)) {
          System.out.println(token);
        }
      } else {
        Ast.Program program = Compiler.parse(source);
        program.definitions().forEach(System.out::println);
        if (program.main() != null) {
          System.out.println(program.main());
        }
      }
    } catch (CompileError e) {
      System.err.printf("%s: %s\n", args[0], e.getMessage());
      System.exit(2);
    }
  }
}

/*
 * Copyright 2026 The Closure Compiler Authors.
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

package org.jsdce.jscomp;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * An abstract representation of a source file that provides access to language-neutral features.
 * The name of the file is used for error reporting.
 */
public final class SourceFile {
  private final String fileName;
  private final String code;

  private SourceFile(String fileName, String code) {
    this.fileName = checkNotNull(fileName);
    this.code = checkNotNull(code);
  }

  public static SourceFile fromCode(String fileName, String code) {
    return new SourceFile(fileName, code);
  }

  /** Reads the whole file as UTF-8. */
  public static SourceFile fromFile(String fileName) throws IOException {
    String code = Files.asCharSource(new File(fileName), StandardCharsets.UTF_8).read();
    return new SourceFile(fileName, code);
  }

  public String getName() {
    return fileName;
  }

  public String getCode() {
    return code;
  }

  @Override
  public String toString() {
    return fileName;
  }
}

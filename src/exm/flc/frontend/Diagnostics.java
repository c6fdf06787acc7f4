/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.flc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.flc.ast.Expr;
import exm.flc.ast.FilePosition;
import exm.flc.common.exceptions.CompilationStoppedException;
import exm.flc.common.exceptions.UserException;

/**
 * Collects the user-facing messages of a compilation.
 *
 * Continuable errors and notes are recorded and compilation goes on.
 * {@link #stop()} and {@link #fatal(Expr, String)} return an exception
 * for the caller to throw, so that control flow at the call site is
 * explicit: <code>throw diag.stop();</code>
 */
public class Diagnostics {

  public static enum Kind {
    ERROR,
    NOTE,
  }

  public static class Message {
    public final Kind kind;
    public final FilePosition pos;
    public final String text;

    public Message(Kind kind, FilePosition pos, String text) {
      this.kind = kind;
      this.pos = pos;
      this.text = text;
    }

    @Override
    public String toString() {
      String prefix = kind == Kind.ERROR ? "error: " : "note: ";
      return (pos == null ? "" : pos.toString() + ": ") + prefix + text;
    }
  }

  private final Logger logger;
  private final List<Message> messages = new ArrayList<Message>();
  private int errorCount = 0;

  public Diagnostics(Logger logger) {
    this.logger = logger;
  }

  public void errorCont(Expr where, String msg) {
    errorCont(where == null ? null : where.findPosition(), msg);
  }

  public void errorCont(FilePosition pos, String msg) {
    Message m = new Message(Kind.ERROR, pos, msg);
    messages.add(m);
    errorCount++;
    logger.debug("user error: " + m);
  }

  public void note(Expr where, String msg) {
    note(where == null ? null : where.findPosition(), msg);
  }

  public void note(FilePosition pos, String msg) {
    Message m = new Message(Kind.NOTE, pos, msg);
    messages.add(m);
    logger.debug(m.toString());
  }

  /**
   * End compilation after continuable errors
   * @return exception to throw
   */
  public CompilationStoppedException stop() {
    Message first = firstError();
    return new CompilationStoppedException(
        first == null ? null : first.pos,
        first == null ? "compilation stopped" : first.text, errorCount);
  }

  /**
   * Record an error that ends compilation
   * @return exception to throw
   */
  public UserException fatal(Expr where, String msg) {
    FilePosition pos = where == null ? null : where.findPosition();
    errorCont(pos, msg);
    return new UserException(pos, msg);
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  public int errorCount() {
    return errorCount;
  }

  public List<Message> getMessages() {
    return Collections.unmodifiableList(messages);
  }

  public List<Message> getErrors() {
    List<Message> result = new ArrayList<Message>();
    for (Message m: messages) {
      if (m.kind == Kind.ERROR) {
        result.add(m);
      }
    }
    return result;
  }

  public List<Message> getNotes() {
    List<Message> result = new ArrayList<Message>();
    for (Message m: messages) {
      if (m.kind == Kind.NOTE) {
        result.add(m);
      }
    }
    return result;
  }

  private Message firstError() {
    for (Message m: messages) {
      if (m.kind == Kind.ERROR) {
        return m;
      }
    }
    return null;
  }
}

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

import exm.flc.common.Settings;
import exm.flc.common.exceptions.InvalidOptionException;
import exm.flc.frontend.typecheck.CallResolver;
import exm.flc.frontend.typecheck.OverloadResolver;

/**
 * Collaborators shared by the forall lowering components for one
 * compilation.
 */
public class LoweringContext {
  public final GlobalContext globals;
  public final CallResolver resolver;
  public final Normalizer normalizer;
  public final Diagnostics diag;

  private final boolean noFastFollowers;
  private final boolean verify;

  public LoweringContext(GlobalContext globals, CallResolver resolver,
      Normalizer normalizer, Diagnostics diag, boolean noFastFollowers,
      boolean verify) {
    this.globals = globals;
    this.resolver = resolver;
    this.normalizer = normalizer;
    this.diag = diag;
    this.noFastFollowers = noFastFollowers;
    this.verify = verify;
  }

  /**
   * Default collaborators, configured from {@link Settings}
   */
  public static LoweringContext fromSettings(GlobalContext globals,
            Diagnostics diag) throws InvalidOptionException {
    return new LoweringContext(globals, new OverloadResolver(globals, diag),
        new CallTempNormalizer(), diag,
        Settings.getBoolean(Settings.NO_FAST_FOLLOWERS),
        Settings.getBoolean(Settings.VERIFY));
  }

  public LibraryEntryPoints entryPoints() {
    return globals.getEntryPoints();
  }

  public boolean noFastFollowers() {
    return noFastFollowers;
  }

  public boolean verify() {
    return verify;
  }
}

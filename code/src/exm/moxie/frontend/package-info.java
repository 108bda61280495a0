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
/**
 * This package contains the per-file entry point and the state shared by the
 * rewrite passes.  {@link exm.moxie.frontend.FileTranspiler} checks const
 * bindings, then runs the passes of {@link exm.moxie.frontend.passes} over a
 * copy of the tree.  Type facts come from
 * {@link exm.moxie.frontend.TypeTracker}; imports the rewritten code needs
 * are collected in {@link exm.moxie.frontend.ImportSet}.
 */
package exm.moxie.frontend;

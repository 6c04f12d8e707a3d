// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pycst.java.syntax;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The parameter list of a function or lambda, grouped as Python groups it: positional-only
 * parameters and their {@code /} marker, ordinary parameters, the {@code *args} parameter or a bare
 * {@code *} marker, keyword-only parameters, and the {@code **kwargs} parameter.
 *
 * <p>When {@code starArg} is null but there are keyword-only parameters, a bare {@code *} is
 * generated.
 */
public final class Parameters extends Node {

  private final ImmutableList<Parameter> posonlyParams;
  @Nullable private final ParamSlash posonlyInd;
  private final ImmutableList<Parameter> params;
  @Nullable private final Node starArg;
  private final ImmutableList<Parameter> kwonlyParams;
  @Nullable private final Parameter starKwarg;

  public Parameters(
      List<Parameter> posonlyParams,
      @Nullable ParamSlash posonlyInd,
      List<Parameter> params,
      @Nullable Node starArg,
      List<Parameter> kwonlyParams,
      @Nullable Parameter starKwarg) {
    super(Kind.PARAMETERS);
    this.posonlyParams = copyOf("posonlyParams", posonlyParams);
    this.posonlyInd = posonlyInd;
    this.params = copyOf("params", params);
    this.starArg = starArg;
    this.kwonlyParams = copyOf("kwonlyParams", kwonlyParams);
    this.starKwarg = starKwarg;
    checkNode(
        starArg == null || starArg instanceof Parameter || starArg instanceof ParamStar,
        "starArg must be a Parameter or ParamStar, got %s",
        starArg == null ? null : starArg.kind());
    checkNode(
        !(starArg instanceof ParamStar) || !this.kwonlyParams.isEmpty(),
        "a bare '*' must be followed by keyword-only parameters");
    checkNode(
        posonlyInd == null || !this.posonlyParams.isEmpty(),
        "a '/' marker must follow at least one parameter");
    for (Parameter param : Iterables.concat(this.posonlyParams, this.params, this.kwonlyParams)) {
      checkNode(
          param.getStar().isEmpty(),
          "parameter '%s' cannot be starred",
          param.getName().getValue());
    }
    checkNode(
        !(starArg instanceof Parameter) || ((Parameter) starArg).getStar().equals("*"),
        "the star parameter must be starred with '*'");
    checkNode(
        starKwarg == null || starKwarg.getStar().equals("**"),
        "the star-star parameter must be starred with '**'");
  }

  public ImmutableList<Parameter> getPosonlyParams() {
    return posonlyParams;
  }

  @Nullable
  public ParamSlash getPosonlyInd() {
    return posonlyInd;
  }

  public ImmutableList<Parameter> getParams() {
    return params;
  }

  /** Returns the {@code *args} Parameter, a bare ParamStar marker, or null. */
  @Nullable
  public Node getStarArg() {
    return starArg;
  }

  public ImmutableList<Parameter> getKwonlyParams() {
    return kwonlyParams;
  }

  @Nullable
  public Parameter getStarKwarg() {
    return starKwarg;
  }

  @Override
  Parameters walkFields(FieldVisitor visitor) {
    ImmutableList<Parameter> posonlyParams =
        visitor.nodes("posonlyParams", this.posonlyParams, Parameter.class);
    ParamSlash posonlyInd = visitor.optional("posonlyInd", this.posonlyInd, ParamSlash.class);
    ImmutableList<Parameter> params = visitor.nodes("params", this.params, Parameter.class);
    Node starArg = visitor.optional("starArg", this.starArg, Node.class);
    ImmutableList<Parameter> kwonlyParams =
        visitor.nodes("kwonlyParams", this.kwonlyParams, Parameter.class);
    Parameter starKwarg = visitor.optional("starKwarg", this.starKwarg, Parameter.class);
    return visitor.changed()
        ? new Parameters(posonlyParams, posonlyInd, params, starArg, kwonlyParams, starKwarg)
        : this;
  }

  @Override
  void codegen(CodegenState state) {
    boolean starIncluded = starArg != null || !kwonlyParams.isEmpty();
    boolean moreValues =
        starIncluded || !params.isEmpty() || !kwonlyParams.isEmpty() || starKwarg != null;
    // The '/' always follows the positional-only parameters, so each gets a comma.
    for (Parameter param : posonlyParams) {
      param.generate(state, true);
    }
    if (posonlyInd != null) {
      posonlyInd.generate(state, moreValues);
    } else if (!posonlyParams.isEmpty()) {
      state.add(moreValues ? "/, " : "/");
    }

    moreValues = starIncluded || starKwarg != null;
    int n = params.size();
    for (int i = 0; i < n; i++) {
      params.get(i).generate(state, i < n - 1 || moreValues);
    }

    moreValues = !kwonlyParams.isEmpty() || starKwarg != null;
    if (starArg != null) {
      starArg.generate(state, moreValues);
    } else if (starIncluded) {
      state.add(moreValues ? "*, " : "*");
    }

    n = kwonlyParams.size();
    for (int i = 0; i < n; i++) {
      kwonlyParams.get(i).generate(state, i < n - 1 || starKwarg != null);
    }
    if (starKwarg != null) {
      starKwarg.generate(state, false);
    }
  }

  /** Returns an empty parameter list. */
  public static Parameters empty() {
    return new Parameters(
        ImmutableList.of(), null, ImmutableList.of(), null, ImmutableList.of(), null);
  }

  /** Returns every Parameter in source order, including the starred ones. */
  public ImmutableList<Parameter> getAll() {
    ImmutableList.Builder<Parameter> all = ImmutableList.builder();
    all.addAll(posonlyParams).addAll(params);
    if (starArg instanceof Parameter) {
      all.add((Parameter) starArg);
    }
    all.addAll(kwonlyParams);
    if (starKwarg != null) {
      all.add(starKwarg);
    }
    return all.build();
  }

  /** Reports whether there are no parameters or markers at all. */
  public boolean isEmpty() {
    return posonlyParams.isEmpty()
        && posonlyInd == null
        && params.isEmpty()
        && starArg == null
        && kwonlyParams.isEmpty()
        && starKwarg == null;
  }
}

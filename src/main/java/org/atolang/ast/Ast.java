/*
 * Copyright 2025 The Atolang Authors
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

package org.atolang.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigDecimal;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The Ast class is a namespace for the node types produced by the ato parser. The set of node types
 * is closed: every node reports one of the {@link Kind} constants, which is what the compiler
 * dispatches on.
 *
 * <p>Nodes are immutable apart from their source location, which the parser may attach once with
 * {@link Node#at}.
 */
public final class Ast {

  // Just a namespace for the contained classes.
  private Ast() {}

  /** Every kind of AST node. */
  public enum Kind {
    FILE("File"),
    SCOPE("Scope"),
    BLOCK_DEFINITION("BlockDefinition"),
    IMPORT_STMT("ImportStmt"),
    PRAGMA_STMT("PragmaStmt"),
    SIGNALDEF_STMT("SignaldefStmt"),
    PIN_DECLARATION("PinDeclaration"),
    FIELD_REF_PART("FieldRefPart"),
    FIELD_REF("FieldRef"),
    FIELD_REF_LIST("FieldRefList"),
    SLICE("Slice"),
    ITERABLE_FIELD_REF("IterableFieldRef"),
    ASSIGNMENT("Assignment"),
    ASSIGNABLE("Assignable"),
    STRING("String"),
    BOOLEAN("Boolean"),
    QUANTITY("Quantity"),
    BOUNDED_QUANTITY("BoundedQuantity"),
    BILATERAL_QUANTITY("BilateralQuantity"),
    BINARY_EXPRESSION("BinaryExpression"),
    GROUP_EXPRESSION("GroupExpression"),
    COMPARISON_CLAUSE("ComparisonClause"),
    COMPARISON_EXPRESSION("ComparisonExpression"),
    ASSERT_STMT("AssertStmt"),
    TEMPLATE_ARG("TemplateArg"),
    TEMPLATE("Template"),
    NEW_EXPRESSION("NewExpression"),
    CONNECT_STMT("ConnectStmt"),
    DIRECTED_CONNECT_STMT("DirectedConnectStmt"),
    FOR_STMT("ForStmt"),
    TRAIT_STMT("TraitStmt"),
    PASS_STMT("PassStmt"),
    STRING_STMT("StringStmt");

    /** The node kind's name as it appears in diagnostics. */
    public final String displayName;

    Kind(String displayName) {
      this.displayName = displayName;
    }

    @Override
    public String toString() {
      return displayName;
    }
  }

  /** A position in a source file; lines and columns are 1-based. */
  public record SourceLocation(int line, int column) {
    @Override
    public String toString() {
      return line + ":" + column;
    }
  }

  /** The base class of all AST nodes. */
  public abstract static class Node {
    private @Nullable SourceLocation location;

    public abstract Kind kind();

    /** Returns where this node started in the source, if the parser recorded it. */
    public @Nullable SourceLocation location() {
      return location;
    }

    /** Records this node's source location; may only be called once. */
    @CanIgnoreReturnValue
    public Node at(int line, int column) {
      Preconditions.checkState(location == null, "Location already set");
      location = new SourceLocation(line, column);
      return this;
    }

    @Override
    public String toString() {
      return (location == null) ? kind().displayName : kind().displayName + "@" + location;
    }
  }

  /** A single .ato file. */
  public static final class File extends Node {
    public final @Nullable String path;
    public final Scope scope;

    public File(@Nullable String path, Scope scope) {
      this.path = path;
      this.scope = Preconditions.checkNotNull(scope);
    }

    @Override
    public Kind kind() {
      return Kind.FILE;
    }
  }

  /** A sequence of statements, in source order. */
  public static final class Scope extends Node {
    public final ImmutableList<Node> stmts;

    public Scope(List<? extends Node> stmts) {
      this.stmts = ImmutableList.copyOf(stmts);
    }

    @Override
    public Kind kind() {
      return Kind.SCOPE;
    }
  }

  /** A {@code module}, {@code component}, or {@code interface} definition. */
  public static final class BlockDefinition extends Node {

    /** The keyword that introduced the block. */
    public enum BlockType {
      MODULE,
      COMPONENT,
      INTERFACE
    }

    public final BlockType blockType;
    public final String typeRefName;
    public final Scope scope;

    public BlockDefinition(BlockType blockType, String typeRefName, Scope scope) {
      this.blockType = Preconditions.checkNotNull(blockType);
      this.typeRefName = Preconditions.checkNotNull(typeRefName);
      this.scope = Preconditions.checkNotNull(scope);
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK_DEFINITION;
    }
  }

  /** {@code import Name} or {@code from "path" import Name}. */
  public static final class ImportStmt extends Node {
    public final @Nullable String path;
    public final String typeRefName;

    public ImportStmt(@Nullable String path, String typeRefName) {
      this.path = path;
      this.typeRefName = Preconditions.checkNotNull(typeRefName);
    }

    @Override
    public Kind kind() {
      return Kind.IMPORT_STMT;
    }
  }

  /** A {@code #pragma} line; {@link #pragma} is the complete text, e.g. {@code #pragma f("x")}. */
  public static final class PragmaStmt extends Node {
    public final @Nullable String pragma;

    public PragmaStmt(@Nullable String pragma) {
      this.pragma = pragma;
    }

    @Override
    public Kind kind() {
      return Kind.PRAGMA_STMT;
    }
  }

  /** {@code signal name}. */
  public static final class SignaldefStmt extends Node {
    public final String name;

    public SignaldefStmt(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.SIGNALDEF_STMT;
    }
  }

  /** {@code pin 1}, {@code pin A1}, or {@code pin "GND"}. */
  public static final class PinDeclaration extends Node {

    /** How the pin label was written. */
    public enum LabelKind {
      NAME,
      NUMBER,
      STRING
    }

    public final LabelKind labelKind;

    /** The label as written, for NAME and STRING labels. */
    public final @Nullable String text;

    /** The label's value, for NUMBER labels. */
    public final @Nullable BigDecimal number;

    private PinDeclaration(
        LabelKind labelKind, @Nullable String text, @Nullable BigDecimal number) {
      this.labelKind = labelKind;
      this.text = text;
      this.number = number;
    }

    public static PinDeclaration ofName(String name) {
      return new PinDeclaration(LabelKind.NAME, Preconditions.checkNotNull(name), null);
    }

    public static PinDeclaration ofString(String text) {
      return new PinDeclaration(LabelKind.STRING, Preconditions.checkNotNull(text), null);
    }

    public static PinDeclaration ofNumber(BigDecimal number) {
      return new PinDeclaration(LabelKind.NUMBER, null, Preconditions.checkNotNull(number));
    }

    @Override
    public Kind kind() {
      return Kind.PIN_DECLARATION;
    }
  }

  /** One dotted component of a field reference, with an optional {@code [key]}. */
  public static final class FieldRefPart extends Node {
    public final String name;
    public final @Nullable String key;

    public FieldRefPart(String name, @Nullable String key) {
      this.name = Preconditions.checkNotNull(name);
      this.key = key;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_REF_PART;
    }
  }

  /** A dotted field reference such as {@code a.b[0].c}, optionally followed by {@code .1} (pin). */
  public static final class FieldRef extends Node {
    public final ImmutableList<FieldRefPart> parts;
    public final @Nullable Integer pin;

    public FieldRef(List<FieldRefPart> parts, @Nullable Integer pin) {
      this.parts = ImmutableList.copyOf(parts);
      this.pin = pin;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_REF;
    }
  }

  /** A bracketed list of field references, e.g. the iterable in {@code for x in [a, b]}. */
  public static final class FieldRefList extends Node {
    public final ImmutableList<FieldRef> items;

    public FieldRefList(List<FieldRef> items) {
      this.items = ImmutableList.copyOf(items);
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_REF_LIST;
    }
  }

  /** {@code [start:stop:step]}; each bound may be omitted. */
  public static final class Slice extends Node {
    public final @Nullable Integer start;
    public final @Nullable Integer stop;
    public final @Nullable Integer step;

    public Slice(@Nullable Integer start, @Nullable Integer stop, @Nullable Integer step) {
      this.start = start;
      this.stop = stop;
      this.step = step;
    }

    @Override
    public Kind kind() {
      return Kind.SLICE;
    }
  }

  /** A field reference to a pointer sequence, optionally sliced, e.g. {@code resistors[1:]}. */
  public static final class IterableFieldRef extends Node {
    public final FieldRef field;
    public final @Nullable Slice slice;

    public IterableFieldRef(FieldRef field, @Nullable Slice slice) {
      this.field = Preconditions.checkNotNull(field);
      this.slice = slice;
    }

    @Override
    public Kind kind() {
      return Kind.ITERABLE_FIELD_REF;
    }
  }

  /** {@code target = value}. */
  public static final class Assignment extends Node {
    public final FieldRef target;
    public final Assignable assignable;

    public Assignment(FieldRef target, Assignable assignable) {
      this.target = Preconditions.checkNotNull(target);
      this.assignable = Preconditions.checkNotNull(assignable);
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGNMENT;
    }
  }

  /** The right-hand side of an assignment. */
  public static final class Assignable extends Node {
    public final Node value;

    public Assignable(Node value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGNABLE;
    }
  }

  /** A string literal; {@link #text} has quotes and escapes already removed. */
  public static final class StringLiteral extends Node {
    public final String text;

    public StringLiteral(String text) {
      this.text = Preconditions.checkNotNull(text);
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }
  }

  /** {@code True} or {@code False}. */
  public static final class BooleanLiteral extends Node {
    public final boolean value;

    public BooleanLiteral(boolean value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }
  }

  /** A number with an optional unit symbol, e.g. {@code 10kohm} or {@code 3}. */
  public static final class Quantity extends Node {
    public final BigDecimal value;
    public final @Nullable String unit;

    public Quantity(BigDecimal value, @Nullable String unit) {
      this.value = Preconditions.checkNotNull(value);
      this.unit = unit;
    }

    @Override
    public Kind kind() {
      return Kind.QUANTITY;
    }
  }

  /** {@code start to end}. */
  public static final class BoundedQuantity extends Node {
    public final Quantity start;
    public final Quantity end;

    public BoundedQuantity(Quantity start, Quantity end) {
      this.start = Preconditions.checkNotNull(start);
      this.end = Preconditions.checkNotNull(end);
    }

    @Override
    public Kind kind() {
      return Kind.BOUNDED_QUANTITY;
    }
  }

  /** {@code nominal +/- tolerance}, where the tolerance may be relative ({@code %} or ppm). */
  public static final class BilateralQuantity extends Node {
    public final Quantity nominal;
    public final Quantity tolerance;

    public BilateralQuantity(Quantity nominal, Quantity tolerance) {
      this.nominal = Preconditions.checkNotNull(nominal);
      this.tolerance = Preconditions.checkNotNull(tolerance);
    }

    @Override
    public Kind kind() {
      return Kind.BILATERAL_QUANTITY;
    }
  }

  /** An arithmetic expression such as {@code a * 2}. */
  public static final class BinaryExpression extends Node {
    public final String operator;
    public final Node left;
    public final Node right;

    public BinaryExpression(String operator, Node left, Node right) {
      this.operator = Preconditions.checkNotNull(operator);
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public Kind kind() {
      return Kind.BINARY_EXPRESSION;
    }
  }

  /** A parenthesized expression. */
  public static final class GroupExpression extends Node {
    public final Node expression;

    public GroupExpression(Node expression) {
      this.expression = Preconditions.checkNotNull(expression);
    }

    @Override
    public Kind kind() {
      return Kind.GROUP_EXPRESSION;
    }
  }

  /** One {@code <op> right} clause of a comparison. */
  public static final class ComparisonClause extends Node {
    public final String operator;
    public final Node right;

    public ComparisonClause(String operator, Node right) {
      this.operator = Preconditions.checkNotNull(operator);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public Kind kind() {
      return Kind.COMPARISON_CLAUSE;
    }
  }

  /** {@code left <op> right [<op> right ...]}. */
  public static final class ComparisonExpression extends Node {
    public final Node left;
    public final ImmutableList<ComparisonClause> clauses;

    public ComparisonExpression(Node left, List<ComparisonClause> clauses) {
      this.left = Preconditions.checkNotNull(left);
      this.clauses = ImmutableList.copyOf(clauses);
    }

    @Override
    public Kind kind() {
      return Kind.COMPARISON_EXPRESSION;
    }
  }

  /** {@code assert <comparison>}. */
  public static final class AssertStmt extends Node {
    public final ComparisonExpression comparison;

    public AssertStmt(ComparisonExpression comparison) {
      this.comparison = Preconditions.checkNotNull(comparison);
    }

    @Override
    public Kind kind() {
      return Kind.ASSERT_STMT;
    }
  }

  /** {@code name=value} inside {@code <...>}. */
  public static final class TemplateArg extends Node {
    public final String name;

    /** A StringLiteral, BooleanLiteral, or unitless Quantity. */
    public final Node value;

    public TemplateArg(String name, Node value) {
      this.name = Preconditions.checkNotNull(name);
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.TEMPLATE_ARG;
    }
  }

  /** {@code <arg=value, ...>}. */
  public static final class Template extends Node {
    public final ImmutableList<TemplateArg> args;

    public Template(List<TemplateArg> args) {
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public Kind kind() {
      return Kind.TEMPLATE;
    }
  }

  /** {@code new Type}, {@code new Type[count]}, or {@code new Type<args>}. */
  public static final class NewExpression extends Node {
    public final String typeRefName;
    public final @Nullable Template template;
    public final @Nullable Integer count;

    public NewExpression(String typeRefName, @Nullable Template template, @Nullable Integer count) {
      this.typeRefName = Preconditions.checkNotNull(typeRefName);
      this.template = template;
      this.count = count;
    }

    @Override
    public Kind kind() {
      return Kind.NEW_EXPRESSION;
    }
  }

  /**
   * {@code left ~ right}. Each side is a FieldRef, or an inline SignaldefStmt or PinDeclaration.
   */
  public static final class ConnectStmt extends Node {
    public final Node left;
    public final Node right;

    public ConnectStmt(Node left, Node right) {
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public Kind kind() {
      return Kind.CONNECT_STMT;
    }
  }

  /**
   * {@code left ~> right} or {@code left <~ right}. The right-hand side of a chain such as {@code a
   * ~> b ~> c} is itself a DirectedConnectStmt.
   */
  public static final class DirectedConnectStmt extends Node {

    /** Which way the bridge points. */
    public enum Direction {
      RIGHT,
      LEFT
    }

    public final Node left;
    public final Node right;
    public final Direction direction;

    public DirectedConnectStmt(Node left, Node right, Direction direction) {
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
      this.direction = Preconditions.checkNotNull(direction);
    }

    @Override
    public Kind kind() {
      return Kind.DIRECTED_CONNECT_STMT;
    }
  }

  /** {@code for target in iterable: scope}; the iterable is a FieldRefList or IterableFieldRef. */
  public static final class ForStmt extends Node {
    public final String target;
    public final Node iterable;
    public final Scope scope;

    public ForStmt(String target, Node iterable, Scope scope) {
      this.target = Preconditions.checkNotNull(target);
      this.iterable = Preconditions.checkNotNull(iterable);
      this.scope = Preconditions.checkNotNull(scope);
    }

    @Override
    public Kind kind() {
      return Kind.FOR_STMT;
    }
  }

  /** {@code trait [target] TraitType[<args>]}. */
  public static final class TraitStmt extends Node {
    public final String typeRefName;
    public final @Nullable FieldRef target;
    public final @Nullable Template template;

    public TraitStmt(String typeRefName, @Nullable FieldRef target, @Nullable Template template) {
      this.typeRefName = Preconditions.checkNotNull(typeRefName);
      this.target = target;
      this.template = template;
    }

    @Override
    public Kind kind() {
      return Kind.TRAIT_STMT;
    }
  }

  /** {@code pass}. */
  public static final class PassStmt extends Node {
    @Override
    public Kind kind() {
      return Kind.PASS_STMT;
    }
  }

  /** A bare string statement, typically a docstring. */
  public static final class StringStmt extends Node {
    public final StringLiteral string;

    public StringStmt(StringLiteral string) {
      this.string = Preconditions.checkNotNull(string);
    }

    @Override
    public Kind kind() {
      return Kind.STRING_STMT;
    }
  }
}

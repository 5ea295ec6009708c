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

package org.atolang.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.atolang.Graph;
import org.atolang.Graph.Step;
import org.atolang.Graph.TypeGraph;
import org.atolang.ast.Ast;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers the AST of one file to TypeGraph declarations.
 *
 * <p>The visitor keeps only lexical bookkeeping (which names and fields are declared where); the
 * structure of types is left to the TypeGraph. Each statement is lowered to a list of {@link
 * Action}s which are applied to the current type before the next statement is visited, so later
 * statements may refer to anything declared by earlier ones.
 *
 * <p>Lowering stops at the first error. An AstVisitor is used for a single compilation.
 */
final class AstVisitor {
  private static final Logger logger = LoggerFactory.getLogger(AstVisitor.class);

  private final Ast.File file;
  private final TypeGraph typeGraph;
  private final BuildState state;
  private final ScopeStack scopes = new ScopeStack();
  private final TypeContextStack types;
  private final LoweringContext context;
  private final Expressions expressions;
  private final AssignmentOverrides assignmentOverrides;
  private final TraitOverrides traitOverrides;
  private final ConnectOverrides connectOverrides;
  private final EnumSet<Experiment> experiments = EnumSet.noneOf(Experiment.class);

  AstVisitor(Ast.File file, TypeGraph typeGraph, CompileOptions options) {
    this.file = file;
    this.typeGraph = typeGraph;
    String filePath = (options.filePath != null) ? options.filePath : file.path;
    this.state = new BuildState(filePath, options.importPath);
    this.types = new TypeContextStack(typeGraph, state);
    this.context = new LoweringContext(options.warnings);
    this.expressions = new Expressions(context, this::fieldPath);
    this.assignmentOverrides = new AssignmentOverrides(context);
    this.traitOverrides = new TraitOverrides(options.warnings);
    this.connectOverrides = new ConnectOverrides(options.warnings);
  }

  /** Lowers the file and returns the resulting state. */
  BuildState build() {
    visit(file);
    return state;
  }

  boolean isEnabled(Experiment experiment) {
    return experiments.contains(experiment);
  }

  private void requireExperiment(Experiment experiment) {
    if (!isEnabled(experiment)) {
      throw DslException.of("Experiment %s is not enabled", experiment);
    }
  }

  /**
   * Lowers one statement and applies the resulting actions to the current type. Any DslException
   * is given the statement's location if it does not already have one.
   */
  private void visit(Ast.Node node) {
    logger.debug("Visiting {}", node);
    try {
      types.apply(lower(node));
    } catch (DslException e) {
      throw e.locatedAt(node);
    }
  }

  private ImmutableList<Action> lower(Ast.Node node) {
    return switch (node.kind()) {
      case FILE -> visitFile((Ast.File) node);
      case SCOPE -> visitScope((Ast.Scope) node);
      case BLOCK_DEFINITION -> visitBlockDefinition((Ast.BlockDefinition) node);
      case IMPORT_STMT -> visitImport((Ast.ImportStmt) node);
      case PRAGMA_STMT -> visitPragma((Ast.PragmaStmt) node);
      case SIGNALDEF_STMT -> visitSignaldef((Ast.SignaldefStmt) node);
      case PIN_DECLARATION -> visitPin((Ast.PinDeclaration) node);
      case ASSIGNMENT -> visitAssignment((Ast.Assignment) node);
      case ASSERT_STMT -> visitAssert((Ast.AssertStmt) node);
      case CONNECT_STMT -> visitConnect((Ast.ConnectStmt) node);
      case DIRECTED_CONNECT_STMT -> visitDirectedConnect((Ast.DirectedConnectStmt) node);
      case FOR_STMT -> visitFor((Ast.ForStmt) node);
      case TRAIT_STMT -> visitTrait((Ast.TraitStmt) node);
      // TODO: attach a docstring trait to the preceding declaration
      case PASS_STMT, STRING_STMT -> ImmutableList.of();
      case FIELD_REF_PART,
          FIELD_REF,
          FIELD_REF_LIST,
          SLICE,
          ITERABLE_FIELD_REF,
          ASSIGNABLE,
          STRING,
          BOOLEAN,
          QUANTITY,
          BOUNDED_QUANTITY,
          BILATERAL_QUANTITY,
          BINARY_EXPRESSION,
          GROUP_EXPRESSION,
          COMPARISON_CLAUSE,
          COMPARISON_EXPRESSION,
          TEMPLATE_ARG,
          TEMPLATE,
          NEW_EXPRESSION -> throw CompilerException.of("%s is not a statement", node.kind());
    };
  }

  private ImmutableList<Action> visitFile(Ast.File node) {
    return visitScope(node.scope);
  }

  private ImmutableList<Action> visitScope(Ast.Scope node) {
    try (ScopeStack.Guard scope = scopes.enter()) {
      visitStatements(node);
    }
    return ImmutableList.of();
  }

  private void visitStatements(Ast.Scope node) {
    for (Ast.Node stmt : node.stmts) {
      visit(stmt);
    }
  }

  private ImmutableList<Action> visitPragma(Ast.PragmaStmt node) {
    String text = node.pragma;
    if (text == null) {
      throw new DslException("Pragma statement has no pragma text");
    }
    Pragmas.Pragma pragma = Pragmas.parse(text);
    if (!pragma.name().equals(Pragmas.EXPERIMENT)) {
      throw DslException.of("Pragma function not recognized: `%s`", text);
    }
    Experiment experiment = null;
    if (pragma.args().size() == 1 && pragma.args().get(0) instanceof String name) {
      experiment = Experiment.forName(name);
    }
    if (experiment == null) {
      throw DslException.of("Experiment not recognized: `%s`", text);
    }
    experiments.add(experiment);
    logger.debug("Enabled experiment {}", experiment);
    return ImmutableList.of();
  }

  private ImmutableList<Action> visitImport(Ast.ImportStmt node) {
    String name = node.typeRefName;
    if (node.path == null) {
      if (!StdlibTypes.isAllowed(name)) {
        throw DslException.of("Standard library import not found: %s", name);
      }
      String replacement = TraitOverrides.replacementFor(name);
      if (replacement != null) {
        context.warnings.deprecated(name, replacement);
      }
    }
    scopes.addSymbol(Symbol.imported(new ImportRef(name, node.path)));
    return ImmutableList.of();
  }

  private ImmutableList<Action> visitBlockDefinition(Ast.BlockDefinition node) {
    if (scopes.depth() != 1) {
      throw new DslException("Nested block definitions are not permitted");
    }
    String name = node.typeRefName;
    if (scopes.isSymbolDefined(name)) {
      throw DslException.of("Symbol `%s` already defined in scope", name);
    }
    String identifier = (state.importPath != null) ? state.importPath + "::" + name : name;
    BlockKind kind = BlockKind.of(node.blockType);
    Graph.Node typeNode = typeGraph.addType(identifier);
    typeGraph.addSourcePointer(typeNode, node);
    state.addTypeRoot(name, typeNode);
    logger.debug("Defining {} {}", kind, identifier);

    try (ScopeStack.Guard scope = scopes.enter();
        ScopeStack.Guard type = types.enter(typeNode)) {
      types.apply(kind.shell(sourceDir(), context));
      visitStatements(node.scope);
    }
    scopes.addSymbol(Symbol.defined(name, typeNode));
    return ImmutableList.of();
  }

  private @Nullable String sourceDir() {
    if (state.filePath == null) {
      return null;
    }
    Path parent = Path.of(state.filePath).getParent();
    return (parent == null) ? null : parent.toString();
  }

  private ImmutableList<Action> visitSignaldef(Ast.SignaldefStmt node) {
    // A pin label is an alias for its pin, so a signal with that name could never be referenced.
    if (scopes.resolveAlias(node.name) != null) {
      throw DslException.of("Field `%s` already defined in scope", node.name);
    }
    FieldPath path = FieldPath.of(node.name);
    scopes.addField(path);
    return ImmutableList.of(
        Action.AddMakeChild.at(path, ChildField.library(StdlibTypes.ELECTRICAL).build()));
  }

  /** Returns the label of a pin as written, with integral numbers rendered without a fraction. */
  static String pinLabel(Ast.PinDeclaration node) {
    return switch (node.labelKind) {
      case NAME, STRING -> node.text;
      case NUMBER -> Quantities.normalize(node.number).toPlainString();
    };
  }

  /** Returns the field name for a pin: {@code pin_} followed by the label made identifier-safe. */
  static String pinIdentifier(String label) {
    return "pin_" + label.replaceAll("[^A-Za-z0-9_]", "_");
  }

  private ImmutableList<Action> visitPin(Ast.PinDeclaration node) {
    String label = pinLabel(node);
    if (scopes.hasField(FieldPath.of(label))) {
      throw DslException.of("Field `%s` already defined in scope", label);
    }
    FieldPath path = FieldPath.of(pinIdentifier(label));
    scopes.addField(path, label);
    scopes.addAlias(label, path);
    ChildField padMatch =
        ChildField.library(StdlibTypes.CAN_ATTACH_TO_PAD_BY_NAME)
            .attribute("regex", "^" + escapeRegex(label) + "$")
            .build();
    return ImmutableList.<Action>builder()
        .add(Action.AddMakeChild.at(path, ChildField.library(StdlibTypes.ELECTRICAL).build()))
        .addAll(
            Action.attachTrait(
                path,
                context.newIdentifier(StdlibTypes.IS_LEAD),
                ChildField.library(StdlibTypes.IS_LEAD).build()))
        .addAll(
            Action.attachTrait(
                path, context.newIdentifier(StdlibTypes.CAN_ATTACH_TO_PAD_BY_NAME), padMatch))
        .build();
  }

  /**
   * Escapes regex metacharacters with backslashes. The pad matcher's regex dialect has no {@code
   * \Q...\E} quoting, so {@link java.util.regex.Pattern#quote} cannot be used.
   */
  static String escapeRegex(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if ("\\^$.|?*+()[]{}-".indexOf(c) >= 0) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }

  /**
   * Returns the path named by a field reference. If the first part names an alias (a loop
   * variable, or a pin label) it is replaced by the aliased path.
   */
  FieldPath fieldPath(Ast.FieldRef node) {
    if (node.pin != null) {
      throw new DslException("Field references with pin suffixes are not supported");
    }
    List<FieldPath.Segment> segments = new ArrayList<>();
    for (Ast.FieldRefPart part : node.parts) {
      segments.add(FieldPath.Segment.of(part.name));
      if (part.key != null) {
        segments.add(FieldPath.Segment.index(part.key));
      }
    }
    if (segments.isEmpty()) {
      throw new DslException("Empty field reference encountered");
    }
    FieldPath path = FieldPath.of(segments);
    FieldPath alias = scopes.resolveAlias(path.root().identifier());
    return (alias == null) ? path : path.withRoot(alias);
  }

  private ImmutableList<Action> visitAssignment(Ast.Assignment node) {
    FieldPath target = fieldPath(node.target);
    String leaf = target.leaf().identifier();
    Ast.Assignable assignable = node.assignable;

    if (AssignmentOverrides.matchesTrait(leaf, assignable)) {
      return assignmentOverrides.handleTrait(target, assignable);
    } else if (AssignmentOverrides.matchesEnumParameter(leaf, assignable)) {
      ChildField literal = assignmentOverrides.enumLiteral(target, assignable);
      return ConstraintSpec.ofLiteral(literal)
          .actions(target, types.resolveReference(target, false), expressions, context);
    } else if (AssignmentOverrides.matchesDefault(leaf, assignable)) {
      return assignmentOverrides.handleDefault(target, assignable, expressions);
    }

    Graph.Node parentReference = null;
    if (target.hasParent()) {
      FieldPath parent = target.parent();
      scopes.ensureDefined(parent);
      parentReference = types.resolveReference(parent, true);
    }
    if (scopes.hasField(target)) {
      throw DslException.of("Field `%s` is already defined in this scope", target);
    }

    Ast.Node value = assignable.value;
    switch (value.kind()) {
      case NEW_EXPRESSION:
        {
          NewChildSpec spec = visitNewExpression((Ast.NewExpression) value);
          scopes.addField(target);
          for (FieldPath element : spec.elements(target)) {
            scopes.addField(element);
          }
          return spec.actions(target, parentReference, context.warnings);
        }
      case QUANTITY:
      case BOUNDED_QUANTITY:
      case BILATERAL_QUANTITY:
        logger.debug("Ignoring quantity assigned to {}", target);
        return Action.noop();
      case STRING:
      case BOOLEAN:
      case BINARY_EXPRESSION:
      case GROUP_EXPRESSION:
      case FIELD_REF:
        return ConstraintSpec.of(value)
            .actions(target, types.resolveReference(target, false), expressions, context);
      default:
        throw CompilerException.of("Unhandled assignable: %s", value.kind());
    }
  }

  private NewChildSpec visitNewExpression(Ast.NewExpression node) {
    Symbol symbol = scopes.resolveSymbol(node.typeRefName);
    if (node.template != null) {
      requireExperiment(Experiment.MODULE_TEMPLATING);
    }
    return new NewChildSpec(symbol, templateArgs(node.template), node.count);
  }

  /** Returns the template arguments as Strings, Booleans, and BigDecimals, in order. */
  private static ImmutableMap<String, Object> templateArgs(Ast.@Nullable Template template) {
    if (template == null) {
      return ImmutableMap.of();
    }
    Map<String, Object> args = new LinkedHashMap<>();
    for (Ast.TemplateArg arg : template.args) {
      Object value =
          switch (arg.value.kind()) {
            case STRING -> ((Ast.StringLiteral) arg.value).text;
            case BOOLEAN -> ((Ast.BooleanLiteral) arg.value).value;
            case QUANTITY -> unitlessNumber(arg.name, (Ast.Quantity) arg.value);
            default ->
                throw DslException.of(
                    "Template argument `%s` must be a string, boolean, or number", arg.name);
          };
      if (args.put(arg.name, value) != null) {
        throw DslException.of("Duplicate template argument `%s`", arg.name);
      }
    }
    return ImmutableMap.copyOf(args);
  }

  private static BigDecimal unitlessNumber(String name, Ast.Quantity quantity) {
    if (quantity.unit != null) {
      throw DslException.of("Template argument `%s` must not have a unit", name);
    }
    return quantity.value;
  }

  private ImmutableList<Action> visitAssert(Ast.AssertStmt node) {
    Ast.ComparisonExpression comparison = node.comparison;
    if (comparison.clauses.size() != 1) {
      throw DslException.of(
          "Assertions must have exactly one comparison, found %s", comparison.clauses.size());
    }
    Ast.ComparisonClause clause = comparison.clauses.get(0);
    String predicate = Expressions.predicateType(clause.operator);
    List<ChildField.Dependant> dependants = new ArrayList<>();
    LinkPath left = expressions.operand(comparison.left, LinkPath.SELF, dependants);
    LinkPath right = expressions.operand(clause.right, LinkPath.SELF, dependants);
    ChildField.Builder builder = ChildField.library(predicate).attribute("constrained", true);
    for (ChildField.Dependant dependant : dependants) {
      builder.before(dependant.identifier(), dependant.field());
    }
    ChildField assertion = builder.operand(left).operand(right).build();
    return ImmutableList.of(
        Action.AddMakeChild.at(FieldPath.of(context.newIdentifier("assert")), assertion));
  }

  /**
   * Returns the path of one side of a connection. A field reference must have a declared root; an
   * inline signal or pin is declared if it has not been already.
   */
  private FieldPath connectable(Ast.Node node) {
    switch (node.kind()) {
      case FIELD_REF:
        {
          FieldPath path = fieldPath((Ast.FieldRef) node);
          scopes.ensureDefined(path.rootPath());
          types.resolveReference(path, false);
          return path;
        }
      case SIGNALDEF_STMT:
        {
          FieldPath path = FieldPath.of(((Ast.SignaldefStmt) node).name);
          if (!scopes.hasField(path)) {
            visit(node);
          }
          return path;
        }
      case PIN_DECLARATION:
        {
          FieldPath path = FieldPath.of(pinIdentifier(pinLabel((Ast.PinDeclaration) node)));
          if (!scopes.hasField(path)) {
            visit(node);
          }
          return path;
        }
      default:
        throw CompilerException.of("Not connectable: %s", node.kind());
    }
  }

  private LinkPath connectLink(Ast.Node node) {
    return connectOverrides.translate(LinkPath.of(connectable(node)));
  }

  private ImmutableList<Action> visitConnect(Ast.ConnectStmt node) {
    LinkPath lhs = connectLink(node.left);
    LinkPath rhs = connectLink(node.right);
    return ImmutableList.of(Action.AddMakeLink.connect(lhs, rhs));
  }

  private static final String IN = "in_";
  private static final String OUT = "out_";

  /**
   * Lowers {@code a ~> b} (or {@code a <~ b}) to a link from a bridge pointer of {@code a} to the
   * opposite pointer of {@code b}. A chain {@code a ~> b ~> c} is lowered one pair at a time.
   */
  private ImmutableList<Action> visitDirectedConnect(Ast.DirectedConnectStmt node) {
    ImmutableList.Builder<Action> actions = ImmutableList.builder();
    Ast.DirectedConnectStmt current = node;
    LinkPath left = connectLink(current.left);
    while (true) {
      Ast.DirectedConnectStmt next =
          (current.right instanceof Ast.DirectedConnectStmt nested) ? nested : null;
      LinkPath right = connectLink((next != null) ? next.left : current.right);
      boolean forward = current.direction == Ast.DirectedConnectStmt.Direction.RIGHT;
      actions.add(
          Action.AddMakeLink.connect(
              bridge(left, forward ? OUT : IN), bridge(right, forward ? IN : OUT)));
      if (next == null) {
        return actions.build();
      }
      current = next;
      left = right;
    }
  }

  private static LinkPath bridge(LinkPath base, String pointer) {
    return base.append(Step.trait(StdlibTypes.CAN_BRIDGE), Step.pointer(pointer));
  }

  private ImmutableList<Action> visitFor(Ast.ForStmt node) {
    requireExperiment(Experiment.FOR_LOOP);
    checkLoopBody(node.scope);
    ImmutableList<FieldPath> items = loopItems(node.iterable);
    logger.debug("Looping {} over {}", node.target, items);
    for (FieldPath item : items) {
      try (ScopeStack.Guard scope = scopes.enter();
          ScopeStack.Guard alias = scopes.temporaryAlias(node.target, item)) {
        visitStatements(node.scope);
      }
    }
    return ImmutableList.of();
  }

  /** Rejects statements that would declare something once per iteration. */
  private static void checkLoopBody(Ast.Scope body) {
    for (Ast.Node stmt : body.stmts) {
      String invalid =
          switch (stmt.kind()) {
            case IMPORT_STMT, PIN_DECLARATION, SIGNALDEF_STMT, TRAIT_STMT ->
                stmt.kind().displayName;
            case ASSIGNMENT ->
                (((Ast.Assignment) stmt).assignable.value.kind() == Ast.Kind.NEW_EXPRESSION)
                    ? "new assignment"
                    : null;
            default -> null;
          };
      if (invalid != null) {
        throw DslException.of("Invalid statement in for loop: %s", invalid).locatedAt(stmt);
      }
    }
  }

  private ImmutableList<FieldPath> loopItems(Ast.Node iterable) {
    if (iterable instanceof Ast.FieldRefList list) {
      return list.items.stream().map(this::fieldPath).collect(ImmutableList.toImmutableList());
    } else if (iterable instanceof Ast.IterableFieldRef ref) {
      SliceSpec slice = SliceSpec.of(ref.slice);
      FieldPath container = fieldPath(ref.field);
      ImmutableList.Builder<FieldPath> members = ImmutableList.builder();
      for (Graph.PointerMember member : types.pointerMembers(container)) {
        String id = member.identifier();
        if (id != null) {
          boolean isIndex = !id.isEmpty() && id.chars().allMatch(Character::isDigit);
          members.add(container.child(new FieldPath.Segment(id, isIndex)));
        }
      }
      return slice.apply(members.build());
    }
    throw DslException.of("Unexpected iterable type: %s", iterable.kind());
  }

  private ImmutableList<Action> visitTrait(Ast.TraitStmt node) {
    requireExperiment(Experiment.TRAITS);
    String name = node.typeRefName;
    Symbol symbol = scopes.resolveSymbol(name);
    if (symbol.importRef == null) {
      throw DslException.of("Trait `%s` must be imported", name);
    }
    FieldPath target = null;
    if (node.target != null) {
      target = fieldPath(node.target);
      scopes.ensureDefined(target.rootPath());
    }
    ImmutableMap<String, Object> args = templateArgs(node.template);

    ChildField trait;
    String identifier;
    if (TraitOverrides.matches(name)) {
      trait = traitOverrides.handle(name, args);
      identifier = context.newIdentifier(trait.typeName);
    } else {
      StdlibTypes.LibraryType libraryType = symbol.isStdlib() ? StdlibTypes.lookup(name) : null;
      if (libraryType == null || !libraryType.isTrait) {
        throw DslException.of(
            "Unknown trait `%s`: only standard library traits are supported", name);
      }
      identifier = context.newIdentifier(name);
      trait = libraryTrait(libraryType, args, target, identifier);
    }
    return Action.attachTrait(target, identifier, trait);
  }

  /**
   * Returns the field for a library trait. If the arguments do not fit its templated constructor
   * the trait is created without them and each string argument becomes a constraint on the trait's
   * child of that name.
   */
  private ChildField libraryTrait(
      StdlibTypes.LibraryType type,
      ImmutableMap<String, Object> args,
      @Nullable FieldPath target,
      String identifier) {
    ChildField.Builder builder = ChildField.library(type.name);
    if (args.isEmpty()) {
      return builder.build();
    } else if (type.acceptsTemplateArgs(args)) {
      return builder.attributes(args).build();
    }
    context.warnings.warn(
        "Template arguments %s do not match trait `%s`; constraining them instead",
        args.keySet(),
        type.name);
    LinkPath mount = (target == null) ? LinkPath.SELF : LinkPath.of(target);
    LinkPath traitPath = mount.child(identifier);
    for (Map.Entry<String, Object> arg : args.entrySet()) {
      if (arg.getValue() instanceof String value) {
        String literalId = context.newIdentifier("lit");
        builder.after(literalId, Expressions.strings(value));
        builder.after(
            context.newIdentifier("constraint"),
            Expressions.subsetConstraint(
                traitPath.child(arg.getKey()), mount.child(literalId), ImmutableList.of()));
      }
    }
    return builder.build();
  }
}

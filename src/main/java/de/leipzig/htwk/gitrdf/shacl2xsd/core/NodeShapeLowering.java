package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.vocabulary.SHACL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeNames;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.All;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Attribute;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Choice;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ComplexType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Declaration;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Element;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ModelGroup;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.SimpleType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Union;

/**
 * Lowers node shapes into complex types.
 * <p>
 * Inheritance chains ({@code sh:node}) are resolved with an explicit stack: every
 * unvisited link of the chain is reserved first, then completed deepest base first.
 * A base or branch met while it is still in progress is referenced by name only and
 * recorded as a forward reference.
 */
public class NodeShapeLowering {

  private static final Logger logger = LoggerFactory.getLogger(NodeShapeLowering.class);

  private final PropertyShapeLowering propertyLowering;

  public NodeShapeLowering(PropertyShapeLowering propertyLowering) {
    this.propertyLowering = propertyLowering;
  }

  public Optional<ComplexType> lower(Resource shape, ConversionContext context) {
    ShapeRegistry registry = context.registry();
    if (registry.isVisited(shape)) {
      return cachedType(shape, registry);
    }

    Deque<Resource> chain = inheritanceChain(shape, context);
    for (Resource link : chain) {
      registry.reserve(link, new ComplexType(ShapeNames.shapeName(context.graph(), link)));
    }
    while (!chain.isEmpty()) {
      complete(chain.pop(), context);
    }
    return cachedType(shape, registry);
  }

  /**
   * Unvisited, defined shapes along the {@code sh:node} chain starting at {@code shape};
   * the deepest base ends up on top of the stack.
   */
  private Deque<Resource> inheritanceChain(Resource shape, ConversionContext context) {
    ShapeGraph graph = context.graph();
    ShapeRegistry registry = context.registry();
    Deque<Resource> chain = new ArrayDeque<>();
    Set<Resource> members = new HashSet<>();

    Resource current = shape;
    while (current != null
        && !registry.isVisited(current)
        && graph.hasStatementsAbout(current)
        && members.add(current)) {
      chain.push(current);
      current = baseOf(graph, current).orElse(null);
    }
    return chain;
  }

  private void complete(Resource shape, ConversionContext context) {
    ShapeGraph graph = context.graph();
    ComplexType type = (ComplexType) context.registry().get(shape).orElseThrow();

    baseOf(graph, shape).ifPresent(base -> type.setBase(resolveBaseName(base, context)));

    ModelGroup group = null;
    boolean unionBody = false;

    Optional<Value> exclusiveChoice = graph.valueOf(shape, SHACL.XONE);
    Optional<Value> disjunction = graph.valueOf(shape, SHACL.OR);
    if (exclusiveChoice.isPresent()) {
      Choice choice = new Choice();
      for (Value branch : ListWalker.walk(graph, exclusiveChoice.get())) {
        addBranch(choice, branch, type, context);
      }
      type.addGroup(choice);
      group = choice;
    } else if (disjunction.isPresent()) {
      List<Value> branches = ListWalker.walk(graph, disjunction.get());
      if (!branches.isEmpty() && ConstraintClassifiers.isScalarUniform(graph, branches)) {
        type.addSimpleType(new SimpleType(new Union(ConstraintClassifiers.memberTypes(graph, branches))));
        unionBody = true;
      } else if (!branches.isEmpty()) {
        Choice choice = new Choice();
        for (Value branch : branches) {
          addBranch(choice, branch, type, context);
        }
        type.addGroup(choice);
        group = choice;
      }
    }

    List<Value> properties = graph.allValuesOf(shape, SHACL.PROPERTY);
    All all = null;
    for (Value property : properties) {
      if (!(property instanceof Resource propertyShape)) {
        continue;
      }
      Optional<Declaration> lowered = propertyLowering.lower(propertyShape, context);
      if (lowered.isEmpty()) {
        continue;
      }
      if (lowered.get() instanceof Attribute attribute) {
        type.addAttribute(attribute);
      } else if (lowered.get() instanceof Element element) {
        if (group != null) {
          group.add(element);
        } else if (unionBody) {
          type.addElement(element);
        } else {
          if (all == null) {
            all = new All();
            type.addGroup(all);
          }
          all.add(element);
        }
      }
    }

    context.registry().store(shape, type);
    emitTargetElements(shape, type, properties.isEmpty(), context);
    context.emitComplexType(type);
    logger.debug("[NODE] Lowered {} to {}", shape, type);
  }

  private String resolveBaseName(Resource base, ConversionContext context) {
    ShapeGraph graph = context.graph();
    ShapeRegistry registry = context.registry();
    String baseName = ShapeNames.shapeName(graph, base);

    if (!graph.hasStatementsAbout(base)) {
      logger.warn("[UNRESOLVED] Base shape {} is referenced but never defined", base);
      context.recordUnresolved(base);
      return baseName;
    }
    if (registry.stateOf(base) == ShapeRegistry.State.IN_PROGRESS) {
      logger.debug("[CYCLE] Base shape {} is still being converted, extending it by name", base);
      context.recordForwardReference(base, baseName);
      return baseName;
    }
    return lower(base, context).map(ComplexType::getName).orElse(baseName);
  }

  private void addBranch(Choice choice, Value branch, ComplexType owner, ConversionContext context) {
    if (!(branch instanceof Resource branchShape)) {
      logger.debug("[SKIP] Literal branch {} in {} cannot be converted", branch, owner.getName());
      return;
    }
    ShapeGraph graph = context.graph();

    if (ConstraintClassifiers.isPropertyShape(graph, branchShape)) {
      Optional<Declaration> lowered = propertyLowering.lower(branchShape, context);
      if (lowered.isPresent() && lowered.get() instanceof Element element) {
        choice.add(element);
      } else if (lowered.isPresent() && lowered.get() instanceof Attribute attribute) {
        owner.addAttribute(attribute);
      }
      return;
    }

    String branchName = ShapeNames.shapeName(graph, branchShape);
    if (!graph.hasStatementsAbout(branchShape)) {
      logger.warn("[UNRESOLVED] Branch shape {} in {} is referenced but never defined", branchShape, owner.getName());
      context.recordUnresolved(branchShape);
    } else if (context.registry().stateOf(branchShape) == ShapeRegistry.State.IN_PROGRESS) {
      context.recordForwardReference(branchShape, branchName);
    } else {
      lower(branchShape, context);
    }
    choice.add(Element.reference(branchName));
  }

  /**
   * One top-level element per target class. A type that only extends its base is
   * skipped and the element points at the base directly.
   */
  private void emitTargetElements(Resource shape, ComplexType type, boolean noOwnProperties,
      ConversionContext context) {
    for (Value ignored : context.graph().allValuesOf(shape, SHACL.TARGET_CLASS)) {
      Element element = new Element(type.getName());
      element.setGeneratedType(type.isPureExtension() && noOwnProperties ? type.getBase() : type.getName());
      context.emitElement(element);
    }
  }

  private static Optional<Resource> baseOf(ShapeGraph graph, Resource shape) {
    return graph.valueOf(shape, SHACL.NODE)
        .filter(Resource.class::isInstance)
        .map(Resource.class::cast);
  }

  private static Optional<ComplexType> cachedType(Resource shape, ShapeRegistry registry) {
    return registry.get(shape)
        .filter(ComplexType.class::isInstance)
        .map(ComplexType.class::cast);
  }
}

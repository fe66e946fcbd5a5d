package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import static de.leipzig.htwk.gitrdf.shacl2xsd.graph.TurtleFixtures.ex;
import static org.assertj.core.api.Assertions.assertThat;

import org.eclipse.rdf4j.model.Resource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.TurtleFixtures;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.All;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Choice;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ComplexType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Element;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.SimpleType;

class NodeShapeLoweringTest {

  private final NodeShapeLowering lowering = new NodeShapeLowering(new PropertyShapeLowering());

  private ConversionContext context;

  private ComplexType lower(String turtle, Resource shape) {
    context = new ConversionContext(TurtleFixtures.graph(turtle));
    return lowering.lower(shape, context).orElseThrow();
  }

  @Test
  @DisplayName("Properties go into an all group and the target class gets an element")
  void minimalShape() {
    ComplexType type = lower("""
        ex:PersonShape a sh:NodeShape ; sh:targetClass ex:Person ;
          sh:property [ sh:path ex:name ; sh:name "name" ; sh:datatype xsd:string ] ;
          sh:property [ sh:path ex:age ; sh:name "age" ; sh:datatype xsd:integer ; sh:minCount 0 ] .
        """, ex("PersonShape"));

    assertThat(type.getName()).isEqualTo("PersonShape");
    assertThat(type.getContent()).singleElement().isInstanceOf(All.class);
    All all = (All) type.getContent().get(0);
    assertThat(all.getElements()).extracting(Element::getName).containsExactly("name", "age");

    assertThat(context.topLevelElements()).singleElement().satisfies(element -> {
      assertThat(element.getName()).isEqualTo("PersonShape");
      assertThat(element.getType()).isEqualTo("PersonShape");
    });
    assertThat(context.complexTypes()).containsExactly(type);
    assertThat(context.topLevelElements().get(0).isGeneratedType()).isTrue();
  }

  @Test
  @DisplayName("An empty sh:xone still opens a choice that collects the properties")
  void emptyExclusiveChoice() {
    ComplexType type = lower("""
        ex:EmptyShape a sh:NodeShape ; sh:xone () ;
          sh:property [ sh:path ex:note ; sh:name "note" ] .
        """, ex("EmptyShape"));

    assertThat(type.getContent()).singleElement().isInstanceOf(Choice.class);
    assertThat(((Choice) type.getContent().get(0)).getElements()).extracting(Element::getName)
        .containsExactly("note");
  }

  @Test
  void attributePropertiesGoOnTheType() {
    ComplexType type = lower("""
        ex:BookShape a sh:NodeShape ;
          sh:property [ sh:path ex:isbn ; sh:name "@isbn" ; sh:minCount 1 ] ;
          sh:property [ sh:path ex:title ; sh:name "title" ] .
        """, ex("BookShape"));

    assertThat(type.getAttributes()).extracting(a -> a.getName()).containsExactly("isbn");
    assertThat(((All) type.getContent().get(0)).getElements()).extracting(Element::getName).containsExactly("title");
  }

  @Nested
  @DisplayName("Alternatives")
  class Alternatives {

    @Test
    @DisplayName("sh:xone over node shapes becomes a choice of references")
    void exclusiveChoice() {
      ComplexType type = lower("""
          ex:PaymentShape a sh:NodeShape ; sh:xone ( ex:CardShape ex:CashShape ) .
          ex:CardShape a sh:NodeShape ; sh:property [ sh:path ex:number ; sh:name "number" ] .
          ex:CashShape a sh:NodeShape ; sh:property [ sh:path ex:amount ; sh:name "amount" ; sh:datatype xsd:decimal ] .
          """, ex("PaymentShape"));

      Choice choice = (Choice) type.getContent().get(0);
      assertThat(choice.getElements()).extracting(Element::getRef).containsExactly("CardShape", "CashShape");
      assertThat(context.complexTypes()).extracting(ComplexType::getName)
          .containsExactly("CardShape", "CashShape", "PaymentShape");
    }

    @Test
    void propertiesJoinTheChoice() {
      ComplexType type = lower("""
          ex:ContactShape a sh:NodeShape ;
            sh:xone ( [ sh:path ex:email ; sh:name "email" ] [ sh:path ex:phone ; sh:name "phone" ] ) ;
            sh:property [ sh:path ex:note ; sh:name "note" ] .
          """, ex("ContactShape"));

      assertThat(type.getContent()).singleElement().isInstanceOf(Choice.class);
      assertThat(((Choice) type.getContent().get(0)).getElements()).extracting(Element::getName)
          .containsExactly("email", "phone", "note");
    }

    @Test
    @DisplayName("sh:or over datatypes becomes a union body")
    void datatypeDisjunctionIsUnion() {
      ComplexType type = lower("""
          ex:IdShape a sh:NodeShape ;
            sh:or ( [ sh:datatype xsd:string ] [ sh:datatype xsd:integer ] ) ;
            sh:property [ sh:path ex:scheme ; sh:name "scheme" ] .
          """, ex("IdShape"));

      assertThat(type.getContent()).hasSize(2);
      SimpleType union = (SimpleType) type.getContent().get(0);
      assertThat(union.getUnion().getMemberTypes()).containsExactly("string", "integer");
      assertThat(type.getContent().get(1)).isInstanceOfSatisfying(Element.class,
          element -> assertThat(element.getName()).isEqualTo("scheme"));
    }

    @Test
    void structuredDisjunctionIsChoice() {
      ComplexType type = lower("""
          ex:PartyShape a sh:NodeShape ; sh:or ( ex:PersonShape ex:OrgShape ) .
          ex:PersonShape a sh:NodeShape ; sh:property [ sh:path ex:name ] .
          ex:OrgShape a sh:NodeShape ; sh:property [ sh:path ex:legalName ] .
          """, ex("PartyShape"));

      assertThat(type.getContent()).singleElement().isInstanceOf(Choice.class);
    }

    @Test
    void undefinedBranchIsReferencedAndRecorded() {
      ComplexType type = lower("""
          ex:PartyShape a sh:NodeShape ; sh:xone ( ex:GhostShape ) .
          """, ex("PartyShape"));

      assertThat(((Choice) type.getContent().get(0)).getElements()).extracting(Element::getRef)
          .containsExactly("GhostShape");
      assertThat(context.unresolvedReferences()).containsExactly("http://example.com/GhostShape");
    }
  }

  @Nested
  @DisplayName("Inheritance")
  class Inheritance {

    @Test
    @DisplayName("sh:node becomes an extension and the base is emitted first")
    void extension() {
      ComplexType type = lower("""
          ex:BaseShape a sh:NodeShape ; sh:property [ sh:path ex:id ; sh:name "id" ] .
          ex:DerivedShape a sh:NodeShape ; sh:node ex:BaseShape ; sh:property [ sh:path ex:extra ; sh:name "extra" ] .
          """, ex("DerivedShape"));

      assertThat(type.getBase()).isEqualTo("BaseShape");
      assertThat(context.complexTypes()).extracting(ComplexType::getName)
          .containsExactly("BaseShape", "DerivedShape");
    }

    @Test
    @DisplayName("A target element of a pure extension points at the base type")
    void pureExtensionTargetUsesBase() {
      lower("""
          ex:BaseShape a sh:NodeShape ; sh:property [ sh:path ex:id ; sh:name "id" ] .
          ex:AliasShape a sh:NodeShape ; sh:targetClass ex:Alias ; sh:node ex:BaseShape .
          """, ex("AliasShape"));

      assertThat(context.topLevelElements()).singleElement().satisfies(element -> {
        assertThat(element.getName()).isEqualTo("AliasShape");
        assertThat(element.getType()).isEqualTo("BaseShape");
      });
    }

    @Test
    void deepChainsCompleteDeepestFirst() {
      lower("""
          ex:AShape a sh:NodeShape ; sh:node ex:BShape ; sh:property [ sh:path ex:a ] .
          ex:BShape a sh:NodeShape ; sh:node ex:CShape ; sh:property [ sh:path ex:b ] .
          ex:CShape a sh:NodeShape ; sh:node ex:DShape ; sh:property [ sh:path ex:c ] .
          ex:DShape a sh:NodeShape ; sh:property [ sh:path ex:d ] .
          """, ex("AShape"));

      assertThat(context.complexTypes()).extracting(ComplexType::getName)
          .containsExactly("DShape", "CShape", "BShape", "AShape");
      assertThat(context.forwardReferences()).isEmpty();
    }

    @Test
    @DisplayName("Cyclic inheritance terminates with a forward reference")
    void cyclicInheritance() {
      ComplexType a = lower("""
          ex:AShape a sh:NodeShape ; sh:node ex:BShape .
          ex:BShape a sh:NodeShape ; sh:node ex:AShape .
          """, ex("AShape"));

      assertThat(a.getBase()).isEqualTo("BShape");
      ComplexType b = (ComplexType) context.registry().get(ex("BShape")).orElseThrow();
      assertThat(b.getBase()).isEqualTo("AShape");
      assertThat(context.forwardReferences()).containsEntry(ex("AShape"), "AShape");
      assertThat(context.registry().stateOf(ex("AShape"))).isEqualTo(ShapeRegistry.State.DONE);
      assertThat(context.registry().stateOf(ex("BShape"))).isEqualTo(ShapeRegistry.State.DONE);
    }

    @Test
    void cyclicBranchesTerminate() {
      ComplexType a = lower("""
          ex:AShape a sh:NodeShape ; sh:xone ( ex:BShape ) .
          ex:BShape a sh:NodeShape ; sh:xone ( ex:AShape ) .
          """, ex("AShape"));

      ComplexType b = (ComplexType) context.registry().get(ex("BShape")).orElseThrow();
      assertThat(((Choice) a.getContent().get(0)).getElements()).extracting(Element::getRef).containsExactly("BShape");
      assertThat(((Choice) b.getContent().get(0)).getElements()).extracting(Element::getRef).containsExactly("AShape");
      assertThat(context.forwardReferences()).containsKey(ex("AShape"));
    }

    @Test
    void undefinedBaseIsExtendedByName() {
      ComplexType type = lower("""
          ex:OrphanShape a sh:NodeShape ; sh:node ex:MissingShape .
          """, ex("OrphanShape"));

      assertThat(type.getBase()).isEqualTo("MissingShape");
      assertThat(context.unresolvedReferences()).containsExactly("http://example.com/MissingShape");
      assertThat(context.complexTypes()).extracting(ComplexType::getName).containsExactly("OrphanShape");
    }
  }

  @Test
  @DisplayName("Lowering the same shape twice returns the cached type")
  void idempotent() {
    ComplexType first = lower("""
        ex:PersonShape a sh:NodeShape ; sh:property [ sh:path ex:name ] .
        """, ex("PersonShape"));

    assertThat(lowering.lower(ex("PersonShape"), context)).containsSame(first);
    assertThat(context.complexTypes()).hasSize(1);
  }
}

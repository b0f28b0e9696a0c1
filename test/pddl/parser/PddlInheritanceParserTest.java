package pddl.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import pddl.model.DomainInfo;
import pddl.model.TypeObjectMap;
import pddl.model.TypeObjects;
import pddl.util.DirectionalGraph;

public class PddlInheritanceParserTest {

	@Test
	public void emptyDeclaration() {
		assertThat(PddlInheritanceParser.parseInheritance("").getVertices().size(), is(0));
		assertThat(PddlInheritanceParser.parseInheritance("  \n ").getVertices().size(), is(0));
	}

	@Test
	public void singleType() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("type1");
		assertThat(graph.getVertices(), is(Arrays.asList("type1", DomainInfo.OBJECT)));
		assertThat(graph.getVerticesWithEdgesFrom("type1"), is(Collections.singletonList(DomainInfo.OBJECT)));
	}

	@Test
	public void singleTypeWithDash() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("basic-type1");
		assertTrue(graph.getVertices().contains("basic-type1"));
	}

	@Test
	public void twoTypes() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("type1 type2");
		assertTrue(graph.getVertices().contains("type1"));
		assertTrue(graph.getVertices().contains("type2"));
	}

	@Test
	public void parentChild() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("child - parent");
		assertThat(graph.getVerticesWithEdgesFrom("child"), is(Collections.singletonList("parent")));
		assertThat(graph.getVerticesWithEdgesFrom("parent"), is(Collections.singletonList(DomainInfo.OBJECT)));
	}

	@Test
	public void parentChildWithNewLine() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("child\n- parent");
		assertThat(graph.getVerticesWithEdgesFrom("child"), is(Collections.singletonList("parent")));
		assertThat(graph.getVerticesWithEdgesFrom("parent"), is(Collections.singletonList(DomainInfo.OBJECT)));
	}

	@Test
	public void parentWithTwoChildren() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("child1 child2 - parent");
		assertThat(graph.getVerticesWithEdgesFrom("child1"), is(Collections.singletonList("parent")));
		assertThat(graph.getVerticesWithEdgesFrom("child2"), is(Collections.singletonList("parent")));
		assertThat(graph.getVerticesWithEdgesFrom("parent"), is(Collections.singletonList(DomainInfo.OBJECT)));
	}

	@Test
	public void parentChildAndOrphan() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("child - parent orphan");
		assertThat(graph.getVerticesWithEdgesFrom("child"), is(Collections.singletonList("parent")));
		assertThat(graph.getVerticesWithEdgesFrom("parent"), is(Collections.singletonList(DomainInfo.OBJECT)));
		assertThat(graph.getVerticesWithEdgesFrom("orphan"), is(Collections.singletonList(DomainInfo.OBJECT)));
	}

	@Test
	public void twoParentChildDeclarations() {
		DirectionalGraph graph = PddlInheritanceParser.parseInheritance("child1 - parent1 child2 - parent2");
		assertThat(graph.getVerticesWithEdgesFrom("child1"), is(Collections.singletonList("parent1")));
		assertThat(graph.getVerticesWithEdgesFrom("child2"), is(Collections.singletonList("parent2")));
		assertThat(graph.getVerticesWithEdgesFrom("parent1"), is(Collections.singletonList(DomainInfo.OBJECT)));
		assertThat(graph.getVerticesWithEdgesFrom("parent2"), is(Collections.singletonList(DomainInfo.OBJECT)));
	}

	@Test
	public void objectTypeMap() {
		TypeObjectMap typeObjects = PddlInheritanceParser.toTypeObjects(
				PddlInheritanceParser.parseInheritance("object1 - type1"));

		assertThat(typeObjects.size(), is(1));
		TypeObjects type1 = typeObjects.getTypeCaseInsensitive("type1").get();
		assertThat(type1.getObjects(), is(Collections.singletonList("object1")));
	}

	@Test
	public void objectTypeMapWithTwoObjects() {
		TypeObjectMap typeObjects = PddlInheritanceParser.toTypeObjects(
				PddlInheritanceParser.parseInheritance("object1 object2 - type1"));

		assertThat(typeObjects.size(), is(1));
		TypeObjects type1 = typeObjects.getTypeCaseInsensitive("TYPE1").get();
		assertTrue(type1.hasObject("object1"));
		assertTrue(type1.hasObject("Object2"));
		assertThat(typeObjects.getTypeOf("object2").get().getType(), is("type1"));
	}

	@Test
	public void untypedObjectsAreObjects() {
		TypeObjectMap typeObjects = PddlInheritanceParser.toTypeObjects(
				PddlInheritanceParser.parseInheritance("a b"));

		assertThat(typeObjects.getTypeCaseInsensitive(DomainInfo.OBJECT).get().getObjects(), is(Arrays.asList("a", "b")));
	}
}

package com.kriskowal.lino;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import org.junit.jupiter.api.Test;

public class LinksGroupTest {

  @Test
  void testSingleLink() {
    LinksGroup group = new LinksGroup(new Link("root"));
    assertEquals(List.of(new Link("root")), group.toLinks());
    assertTrue(group.getGroups().isEmpty());
  }

  @Test
  void testFlattenWithAncestors() {
    Link root = new Link("root");
    Link child1 = new Link("child1");
    Link child2 = new Link("child2");
    Link grandchild = new Link("grandchild");
    LinksGroup group =
        new LinksGroup(
            root,
            List.of(
                new LinksGroup(child1),
                new LinksGroup(child2, List.of(new LinksGroup(grandchild)))));

    List<Link> links = group.toLinks();
    assertEquals(4, links.size());
    assertEquals(root, links.get(0));
    assertEquals(Link.of(root, child1), links.get(1));
    assertEquals(Link.of(root, child2), links.get(2));
    assertEquals(Link.of(Link.of(root, child2), grandchild), links.get(3));
    assertEquals(
        "(root)\n(root child1)\n(root child2)\n((root child2) grandchild)", group.format());
  }

  @Test
  void testAppendTo() {
    List<Link> links = new ArrayList<>(List.of(new Link("before")));
    new LinksGroup(new Link("a"), List.of(new LinksGroup(new Link("b")))).appendTo(links);
    assertEquals(
        List.of(new Link("before"), new Link("a"), Link.of(new Link("a"), new Link("b"))), links);
  }

  @Test
  void testEquality() {
    LinksGroup a = new LinksGroup(new Link("a"), List.of(new LinksGroup(new Link("b"))));
    LinksGroup b = new LinksGroup(new Link("a"), List.of(new LinksGroup(new Link("b"))));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new LinksGroup(new Link("a")));
  }
}

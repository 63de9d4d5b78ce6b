package com.example.jmxscenario.util;

import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logical parent/children relation of a JMX document.
 *
 * <p>JMX does not nest an element's children inside the element. Instead every element is
 * followed by a sibling {@code hashTree} that holds its children, which are themselves
 * element/hashTree pairs. This index is built in one left-to-right pairing pass per
 * {@code hashTree} and never modifies the DOM.
 *
 * <p>A {@code hashTree} with no element in front of it has no owner of its own. Its elements
 * join the enclosing group in document order: they become children of the element that owns
 * the enclosing container, or roots when the group is top level.
 */
public final class HashTreeIndex {

  public static final String HASH_TREE = "hashTree";

  private final Map<Element, List<Element>> children;
  private final List<Element> roots;

  private HashTreeIndex(Map<Element, List<Element>> children, List<Element> roots) {
    this.children = children;
    this.roots = roots;
  }

  /**
   * Builds the index from the document root ({@code jmeterTestPlan}) or from any
   * {@code hashTree} element.
   */
  public static HashTreeIndex build(Element root) {
    Map<Element, List<Element>> map = new IdentityHashMap<>();
    List<Element> roots = new ArrayList<>();
    if (root != null) {
      if (HASH_TREE.equals(root.getTagName())) {
        pair(root, roots, map);
      } else {
        for (Element el : JmxProps.childElements(root)) {
          if (HASH_TREE.equals(el.getTagName())) pair(el, roots, map);
        }
      }
    }
    return new HashTreeIndex(map, roots);
  }

  private static void pair(Element tree, List<Element> group, Map<Element, List<Element>> map) {
    List<Element> siblings = JmxProps.childElements(tree);
    int i = 0;
    while (i < siblings.size()) {
      Element current = siblings.get(i);
      if (HASH_TREE.equals(current.getTagName())) {
        // unowned container: its elements belong to the enclosing group
        pair(current, group, map);
        i++;
        continue;
      }
      group.add(current);
      List<Element> logical = new ArrayList<>();
      map.put(current, logical);
      if (i + 1 < siblings.size() && HASH_TREE.equals(siblings.get(i + 1).getTagName())) {
        pair(siblings.get(i + 1), logical, map);
        i += 2;
      } else {
        i++;
      }
    }
  }

  /** Top-level elements in document order. */
  public List<Element> roots() {
    return Collections.unmodifiableList(roots);
  }

  public List<Element> childrenOf(Element element) {
    List<Element> list = children.get(element);
    return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
  }

  public boolean contains(Element element) {
    return children.containsKey(element);
  }

  public int size() {
    return children.size();
  }
}

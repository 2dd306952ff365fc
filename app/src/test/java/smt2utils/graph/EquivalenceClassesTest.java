package smt2utils.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class EquivalenceClassesTest {

  @Test
  void unionJoinsClassesOnce() {
    EquivalenceClasses classes = withSingletons(4);
    assertTrue(classes.union(0, 1), "Distinct classes are joined");
    assertFalse(classes.union(1, 0), "Second union is a no-op");
    assertTrue(classes.same(0, 1), "0 and 1 share a class");
    assertFalse(classes.same(0, 2), "2 is still alone");
    assertEquals(3, classes.classCount(), "Four singletons minus one union");
    assertEquals(2, classes.classSize(1), "Class of 1 has two members");
  }

  @Test
  void equalSizesKeepTheLowerRoot() {
    EquivalenceClasses classes = withSingletons(3);
    classes.union(2, 1);
    assertEquals(1, classes.find(2), "Lower id represents a tie");
    classes.union(0, 2);
    assertEquals(1, classes.find(0), "Larger class keeps its root");
  }

  @Test
  void growsPastInitialCapacity() {
    EquivalenceClasses classes = withSingletons(100);
    for (int i = 1; i < 100; i++) {
      classes.union(i - 1, i);
    }
    assertEquals(1, classes.classCount(), "Chain collapses to one class");
    assertEquals(100, classes.classSize(99), "Every node is in it");
    assertEquals(classes.find(0), classes.find(99), "Ends of the chain agree");
  }

  @Test
  void rejectsUnknownIds() {
    EquivalenceClasses classes = withSingletons(2);
    assertThrows(IndexOutOfBoundsException.class, () -> classes.find(2), "Id past the end");
    assertThrows(IndexOutOfBoundsException.class, () -> classes.find(-1), "Negative id");
  }

  private static EquivalenceClasses withSingletons(int count) {
    EquivalenceClasses classes = new EquivalenceClasses();
    for (int i = 0; i < count; i++) {
      classes.add();
    }
    return classes;
  }
}

package relayql.transform;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Field names the printer must guarantee are selected at one level of a selection set, in the
 * order they were required. Immutable; each level of the descent builds its own.
 */
public record RequisiteFields(Set<String> names) {

  private static final RequisiteFields EMPTY = new RequisiteFields(Set.of());

  public RequisiteFields {
    names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
  }

  public static RequisiteFields empty() {
    return EMPTY;
  }

  public RequisiteFields with(String name) {
    if (names.contains(name)) {
      return this;
    }
    Set<String> copy = new LinkedHashSet<>(names);
    copy.add(name);
    return new RequisiteFields(copy);
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }
}

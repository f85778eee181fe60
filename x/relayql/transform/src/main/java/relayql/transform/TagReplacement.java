package relayql.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import relayql.api.artifact.ConcreteArtifact;

/** What replaces an embedded GraphQL literal in the source. */
public sealed interface TagReplacement {

  /** An operation, or the one fragment of a literal assigned to an object property. */
  record Single(ConcreteArtifact artifact) implements TagReplacement {}

  /** A literal of fragments, replaced by an object keyed by each fragment's property name. */
  record FragmentMap(Map<String, ConcreteArtifact> artifacts) implements TagReplacement {
    public FragmentMap {
      artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }
  }
}

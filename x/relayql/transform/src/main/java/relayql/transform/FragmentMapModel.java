package relayql.transform;

import java.util.List;

/** Model of the object that replaces a literal holding several fragments. */
public record FragmentMapModel(List<Entry> entries) {

  // ST (StringTemplate) requires JavaBean-style getters
  public List<Entry> getEntries() {
    return entries;
  }

  /**
   * One property of the object.
   *
   * @param key the property key, quoted when it is not an identifier
   * @param value the printed artifact function
   */
  public record Entry(String key, String value) {

    public String getKey() {
      return key;
    }

    public String getValue() {
      return value;
    }
  }
}

package io.intellixity.calcaudit.model;

/**
 * One calculated-field definition as supplied by the metadata source.\n
 *
 * @param fundId owning fund identifier\n
 * @param datagroupId datagroup identifier (lookup name)\n
 * @param keyName key identifier (lookup name)\n
 * @param fullKey canonical {@code FUND!DATAGROUP!KEY!context} identifier, unique per run\n
 * @param calculationLevel declared level; 0 means raw\n
 * @param current {@code true} for the current snapshot, {@code false} for point-in-time\n
 * @param formula formula text, or {@code null} for raw keys\n
 */
public record KeyRecord(
    String fundId,
    String datagroupId,
    String keyName,
    String fullKey,
    int calculationLevel,
    boolean current,
    String formula
) {
  public static final char SEPARATOR = '!';

  public KeyRecord {
    if (fullKey == null || fullKey.isBlank()) throw new IllegalArgumentException("fullKey is required");
    if (calculationLevel < 0) {
      throw new IllegalArgumentException("calculationLevel must be >= 0 for " + fullKey + ": " + calculationLevel);
    }
  }

  public Context context() { return Context.ofCurrentFlag(current); }

  public boolean hasFormula() { return formula != null; }

  public static String fullKey(String fundId, String datagroupId, String keyName, Context context) {
    return fundId + SEPARATOR + datagroupId + SEPARATOR + keyName + SEPARATOR + context.tag();
  }
}

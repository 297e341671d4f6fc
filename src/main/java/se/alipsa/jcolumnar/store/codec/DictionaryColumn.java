package se.alipsa.jcolumnar.store.codec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dictionary encoded column slice. Distinct values are stored once and every
 * row keeps a code into the dictionary; {@code -1} marks a null row. Codes use
 * one byte when the dictionary has at most 127 entries and a short otherwise.
 */
final class DictionaryColumn implements EncodedColumn {

  private final Object[] dictionary;
  private final byte[] byteCodes;
  private final short[] shortCodes;
  private final int size;

  DictionaryColumn(List<Object> values) {
    Map<Object, Integer> codes = new HashMap<>();
    List<Object> dict = new ArrayList<>();
    int[] raw = new int[values.size()];
    for (int i = 0; i < values.size(); i++) {
      Object value = values.get(i);
      if (value == null) {
        raw[i] = -1;
        continue;
      }
      Integer code = codes.get(value);
      if (code == null) {
        code = dict.size();
        codes.put(value, code);
        dict.add(value);
      }
      raw[i] = code;
    }
    if (dict.size() > Short.MAX_VALUE) {
      throw new IllegalArgumentException("Dictionary too large: " + dict.size() + " distinct values");
    }
    this.dictionary = dict.toArray();
    this.size = values.size();
    if (dictionary.length <= Byte.MAX_VALUE) {
      byteCodes = new byte[size];
      for (int i = 0; i < size; i++) {
        byteCodes[i] = (byte) raw[i];
      }
      shortCodes = null;
    } else {
      shortCodes = new short[size];
      for (int i = 0; i < size; i++) {
        shortCodes[i] = (short) raw[i];
      }
      byteCodes = null;
    }
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public Object get(int index) {
    int code = byteCodes != null ? byteCodes[index] : shortCodes[index];
    return code < 0 ? null : dictionary[code];
  }

  /**
   * Number of distinct non-null values.
   *
   * @return the dictionary size
   */
  int dictionarySize() {
    return dictionary.length;
  }

  @Override
  public Encoding encoding() {
    return Encoding.DICTIONARY;
  }

  @Override
  public long estimatedBytes() {
    long codeBytes = byteCodes != null ? byteCodes.length : 2L * shortCodes.length;
    return codeBytes + 32L * dictionary.length;
  }
}

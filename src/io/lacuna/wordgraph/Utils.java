package io.lacuna.wordgraph;

import java.nio.charset.Charset;
import java.util.Comparator;

/**
 * @author ztellman
 */
public class Utils {

  /**
   * Orders byte strings as unsigned bytes, shorter strings first when one is a prefix of the other.
   */
  public static int compare(byte[] a, byte[] b) {
    int n = Math.min(a.length, b.length);
    for (int i = 0; i < n; i++) {
      int cmp = Integer.compare(a[i] & 0xFF, b[i] & 0xFF);
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(a.length, b.length);
  }

  /**
   * @return a comparator ordering strings by their encoded bytes, which is the order a builder expects them in
   */
  public static Comparator<String> encodedOrder(Charset charset) {
    return (a, b) -> compare(a.getBytes(charset), b.getBytes(charset));
  }

  /**
   * @return the length of the longest common prefix of {@code a} and {@code b}
   */
  public static int commonPrefix(byte[] a, byte[] b) {
    int n = Math.min(a.length, b.length);
    for (int i = 0; i < n; i++) {
      if (a[i] != b[i]) {
        return i;
      }
    }
    return n;
  }

  /**
   * @return the label as a character if it's printable ASCII, otherwise as two hex digits
   */
  public static String printable(int label) {
    if (label >= 0x20 && label <= 0x7E) {
      return String.valueOf((char) label);
    }
    return String.format("%02X", label);
  }
}

package com.consullo.prettyprint.core;

/**
 * Measures how many terminal columns a string occupies.
 *
 * <p>
 * Most characters take one column. East Asian wide and fullwidth characters and most emoji take
 * two. Combining marks, zero-width formatting characters and control characters take none. This
 * follows the usual wcwidth tables closely enough for laying out text; it does not attempt to
 * handle grapheme clusters.
 * </p>
 */
public final class TextWidth {

  private TextWidth() {
  }

  /**
   * Returns the display width of a string.
   *
   * @param s string to measure
   * @return width in columns
   */
  public static int of(String s) {
    int width = 0;
    int i = 0;
    int n = s.length();
    while (i < n) {
      int cp = s.codePointAt(i);
      width += codePointWidth(cp);
      i += Character.charCount(cp);
    }
    return width;
  }

  /**
   * Returns the number of characters (code points) in a string.
   *
   * @param s string
   * @return code point count
   */
  public static int charCount(String s) {
    return s.codePointCount(0, s.length());
  }

  /**
   * Returns the display width of a single code point: 0, 1 or 2.
   *
   * @param cp code point
   * @return width in columns
   */
  public static int codePointWidth(int cp) {
    if (cp == 0) {
      return 0;
    }
    // C0/C1 controls and DEL
    if (cp < 0x20 || (cp >= 0x7F && cp < 0xA0)) {
      return 0;
    }
    if (cp < 0x300) {
      return 1;
    }
    if (isZeroWidth(cp)) {
      return 0;
    }
    if (isWide(cp)) {
      return 2;
    }
    return 1;
  }

  private static boolean isZeroWidth(int cp) {
    // Zero width space, joiners, direction marks, word joiner, BOM
    if ((cp >= 0x200B && cp <= 0x200F) || cp == 0x2060 || cp == 0xFEFF) {
      return true;
    }
    int type = Character.getType(cp);
    return type == Character.NON_SPACING_MARK
        || type == Character.ENCLOSING_MARK
        || type == Character.FORMAT;
  }

  private static boolean isWide(int cp) {
    if (cp < 0x1100) {
      return false;
    }
    return (cp <= 0x115F) // Hangul Jamo init. consonants
        || cp == 0x2329 || cp == 0x232A
        || (cp >= 0x2E80 && cp <= 0xA4CF && cp != 0x303F) // CJK ... Yi
        || (cp >= 0xAC00 && cp <= 0xD7A3) // Hangul syllables
        || (cp >= 0xF900 && cp <= 0xFAFF) // CJK compatibility ideographs
        || (cp >= 0xFE10 && cp <= 0xFE19) // vertical forms
        || (cp >= 0xFE30 && cp <= 0xFE6F) // CJK compatibility forms
        || (cp >= 0xFF00 && cp <= 0xFF60) // fullwidth forms
        || (cp >= 0xFFE0 && cp <= 0xFFE6)
        || (cp >= 0x1F300 && cp <= 0x1F64F) // pictographs, emoticons
        || (cp >= 0x1F900 && cp <= 0x1F9FF) // supplemental symbols and pictographs
        || (cp >= 0x20000 && cp <= 0x2FFFD)
        || (cp >= 0x30000 && cp <= 0x3FFFD);
  }
}

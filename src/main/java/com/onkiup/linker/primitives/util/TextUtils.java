package com.onkiup.linker.primitives.util;

public interface TextUtils {

  /**
   * Maximum number of input characters quoted by error messages
   */
  int PREVIEW_LENGTH = 20;

  static String head(CharSequence what, int len) {
    if (what.length() <= len) {
      return what.toString();
    }
    int end = len;
    // keep surrogate pairs whole
    if (end > 0 && Character.isHighSurrogate(what.charAt(end - 1))) {
      end--;
    }
    return what.subSequence(0, end).toString();
  }

  static String preview(CharSequence what) {
    return head(what, PREVIEW_LENGTH);
  }

  static String sanitize(Object what) {
    return what == null ? "null" : sanitize(what.toString());
  }

  static String sanitize(String what) {
    return what == null ? null : what.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
  }
}

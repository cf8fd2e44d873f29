package com.s3vectors.filesearch.service.embedding;

/** How text longer than the configured limit is cut before embedding. */
public enum TextTruncationStrategy {
  /** Keep the first characters. */
  END {
    @Override
    public String truncate(String text, int maxLength) {
      return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
  },
  /** Keep the last characters. */
  START {
    @Override
    public String truncate(String text, int maxLength) {
      return text.length() <= maxLength ? text : text.substring(text.length() - maxLength);
    }
  },
  /** Keep a prefix and a suffix of half the limit each and drop the middle. */
  MIDDLE {
    @Override
    public String truncate(String text, int maxLength) {
      if (text.length() <= maxLength) {
        return text;
      }
      int half = maxLength / 2;
      int tail = maxLength - half;
      return text.substring(0, half) + text.substring(text.length() - tail);
    }
  };

  public abstract String truncate(String text, int maxLength);
}

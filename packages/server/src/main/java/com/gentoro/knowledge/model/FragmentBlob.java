package com.gentoro.knowledge.model;

import java.util.Base64;

/** Binary payload attached to a fragment; {@code data} is base64. */
public record FragmentBlob(String mimeType, String data) {

  public static FragmentBlob of(String mimeType, byte[] bytes) {
    return new FragmentBlob(mimeType, Base64.getEncoder().encodeToString(bytes));
  }
}

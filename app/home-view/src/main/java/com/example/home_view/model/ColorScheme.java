package com.example.home_view.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** クライアントへ数値コードで渡す配色設定。 */
public enum ColorScheme {
  AUTOMATIC(1),
  NIGHT(2),
  LIGHT(3);

  private final int code;

  ColorScheme(int code) {
    this.code = code;
  }

  @JsonValue
  public int code() {
    return code;
  }
}

package com.assetplatform.assetapi.api;

public record ActionResponse(String status) {
  public static final String SUCCESS = "Success";

  public static ActionResponse success() {
    return new ActionResponse(SUCCESS);
  }
}

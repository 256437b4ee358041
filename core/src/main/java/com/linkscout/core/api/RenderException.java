package com.linkscout.core.api;

/** 페이지를 불러오지 못함(네트워크/타임아웃/브라우저 오류). 그 URL 은 도달 불가로 보고된다. */
public class RenderException extends Exception {
    public RenderException(String message) { super(message); }
    public RenderException(String message, Throwable cause) { super(message, cause); }
}

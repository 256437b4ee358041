package com.linkscout.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/** {@code --http-basic=user:pass} 값 */
public record BasicAuth(String user, String password) {

    public BasicAuth {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(password, "password");
    }

    /** null/공백이면 null. ':' 가 없으면 설정 오류 */
    public static BasicAuth parse(String userPass) {
        if (userPass == null || userPass.isBlank()) return null;
        int i = userPass.indexOf(':');
        if (i < 0) throw new IllegalArgumentException("http-basic must be in user:pass form");
        return new BasicAuth(userPass.substring(0, i), userPass.substring(i + 1));
    }

    /** Authorization 헤더 값 */
    public String headerValue() {
        String token = Base64.getEncoder()
                .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    @Override public String toString() {
        return "BasicAuth[user=" + user + ", password=***]";
    }
}

package com.pitchmate.chat.model;

/**
 * 대화 턴 (role, content)
 */
public record Turn(String role, String content) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static Turn user(String content) {
        return new Turn(ROLE_USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(ROLE_ASSISTANT, content);
    }

    public boolean isUser() {
        return ROLE_USER.equals(role);
    }
}

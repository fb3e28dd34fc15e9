package com.pitchmate.chat.model;

/**
 * 요청 파라미터
 * <p>
 * 호출자가 턴마다 재전송하는 값들. maxChars / maxTokens 는 원시 값 그대로 받아
 * 길이 제어 단계에서 안전하게 변환한다.
 */
public class RequestParams {

    private String segment;
    private boolean allowZeroShot;
    private Progress scriptProgress;
    private String lastSlot;
    private String lengthStyle;
    private Object maxChars;
    private Object maxTokens;

    public String getSegment() {
        return segment;
    }

    public void setSegment(String segment) {
        this.segment = segment;
    }

    public boolean isAllowZeroShot() {
        return allowZeroShot;
    }

    public void setAllowZeroShot(boolean allowZeroShot) {
        this.allowZeroShot = allowZeroShot;
    }

    public Progress getScriptProgress() {
        return scriptProgress;
    }

    public void setScriptProgress(Progress scriptProgress) {
        this.scriptProgress = scriptProgress;
    }

    public String getLastSlot() {
        return lastSlot;
    }

    public void setLastSlot(String lastSlot) {
        this.lastSlot = lastSlot;
    }

    public String getLengthStyle() {
        return lengthStyle;
    }

    public void setLengthStyle(String lengthStyle) {
        this.lengthStyle = lengthStyle;
    }

    public Object getMaxChars() {
        return maxChars;
    }

    public void setMaxChars(Object maxChars) {
        this.maxChars = maxChars;
    }

    public Object getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Object maxTokens) {
        this.maxTokens = maxTokens;
    }
}

package com.gs.ep.cadtranslate.translate;

/**
 * 单个实体的替换结果。每个实体计为一次处理，并且恰好落入翻译、跳过、出错之一。
 */
public final class SubstitutionOutcome {

    public enum State {
        TRANSLATED,
        SKIPPED,
        ERRORED
    }

    private final String entity;
    private final State state;
    private final MatchMethod method;
    private final String message;

    private SubstitutionOutcome(String entity, State state, MatchMethod method, String message) {
        this.entity = entity;
        this.state = state;
        this.method = method;
        this.message = message;
    }

    public static SubstitutionOutcome translated(String entity, MatchMethod method) {
        return new SubstitutionOutcome(entity, State.TRANSLATED, method, null);
    }

    public static SubstitutionOutcome skipped(String entity, MatchMethod method) {
        return new SubstitutionOutcome(entity, State.SKIPPED, method, null);
    }

    public static SubstitutionOutcome errored(String entity, String message) {
        return new SubstitutionOutcome(entity, State.ERRORED, null, message);
    }

    public String getEntity() {
        return entity;
    }

    public State getState() {
        return state;
    }

    /**
     * 匹配方法；空白文字跳过和出错时为 null
     */
    public MatchMethod getMethod() {
        return method;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return entity + ": " + state + (method == null ? "" : " (" + method + ")");
    }
}

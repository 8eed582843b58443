package com.eainde.flowconverter.config;

import java.util.Objects;

/**
 * Conversion defaults.
 *
 * <pre>
 * ConverterSettings settings = ConverterSettings.builder()
 *         .validate(true)
 *         .bootstrapInput("What is LangGraph?")
 *         .build();
 * </pre>
 */
public class ConverterSettings {

    public static final boolean DEFAULT_VALIDATE = true;
    public static final String DEFAULT_BOOTSTRAP_INPUT = "Test input";
    public static final String DEFAULT_STATE_CLASS_NAME = "GraphState";

    private final boolean validate;
    private final String bootstrapInput;
    private final String stateClassName;

    private ConverterSettings(Builder builder) {
        this.validate = builder.validate;
        this.bootstrapInput = Objects.requireNonNull(builder.bootstrapInput, "bootstrapInput");
        this.stateClassName = Objects.requireNonNull(builder.stateClassName, "stateClassName");
        if (!stateClassName.matches("[A-Za-z_]\\w*")) {
            throw new IllegalArgumentException("stateClassName is not a Python identifier: " + stateClassName);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConverterSettings defaults() {
        return builder().build();
    }

    public boolean isValidate() { return validate; }
    public String getBootstrapInput() { return bootstrapInput; }
    public String getStateClassName() { return stateClassName; }

    @Override
    public String toString() {
        return "ConverterSettings[validate=" + validate + ", bootstrapInput='" + bootstrapInput
                + "', stateClassName=" + stateClassName + "]";
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private boolean validate = DEFAULT_VALIDATE;
        private String bootstrapInput = DEFAULT_BOOTSTRAP_INPUT;
        private String stateClassName = DEFAULT_STATE_CLASS_NAME;

        private Builder() {}

        /** Whether {@code convert(Path)} validates the emitted program. */
        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        /** Value of {@code input} passed to the graph by the generated {@code __main__} stanza. */
        public Builder bootstrapInput(String bootstrapInput) {
            this.bootstrapInput = bootstrapInput;
            return this;
        }

        public Builder stateClassName(String stateClassName) {
            this.stateClassName = stateClassName;
            return this;
        }

        public ConverterSettings build() {
            return new ConverterSettings(this);
        }
    }
}

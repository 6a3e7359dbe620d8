package io.formulakit.standalone.config;

/**
 * Settings for the command-line runner. Use {@link #builder()} to construct instances; every field
 * has a default.
 *
 * @param catalog       path of a JSON or YAML formula catalog; {@code null} selects the bundled
 *                      example library
 * @param randomSeed    seed for {@code random()}, {@code rand} and {@code randf}; {@code null}
 *                      selects the unseeded thread-local source
 * @param inputPooling  reuse one binding context per formula in {@code eval}
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record CliConfig(
        String catalog, Long randomSeed, boolean inputPooling, String loggingFormat, String loggingLevel) {

    /** Configuration with every default applied. */
    public static final CliConfig DEFAULT = builder().build();

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private String catalog;
        private Long randomSeed;
        private boolean inputPooling = true;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder catalog(String catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder inputPooling(boolean inputPooling) {
            this.inputPooling = inputPooling;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException(
                        "Invalid logging.format '" + loggingFormat + "': expected 'text' or 'json'");
            }
            return new CliConfig(catalog, randomSeed, inputPooling, loggingFormat, loggingLevel);
        }
    }
}

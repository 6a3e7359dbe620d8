package io.formulakit.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variables override YAML values. A variable counts as set only if it is defined and
 * its trimmed value is non-empty.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void catalogOverridesYaml() {
            envVars.put("FORMULAKIT_CATALOG", " /srv/formulas.json ");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).catalog()).isEqualTo("/srv/formulas.json");
        }

        @Test
        void seedOverridesYaml() {
            envVars.put("FORMULAKIT_RANDOM_SEED", "7");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).randomSeed()).isEqualTo(7L);
        }

        @Test
        void poolingOverridesYaml() {
            envVars.put("FORMULAKIT_INPUT_POOLING", "true");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).inputPooling()).isTrue();
        }

        @Test
        void loggingOverridesYaml() {
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "ERROR");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("ERROR");
        }

        @Test
        void overlayAppliesWithoutConfigFile() {
            envVars.put("FORMULAKIT_RANDOM_SEED", "99");
            envVars.put("FORMULAKIT_INPUT_POOLING", "false");

            CliConfig config = ConfigLoader.resolve(null, envLookup());

            assertThat(config.randomSeed()).isEqualTo(99L);
            assertThat(config.inputPooling()).isFalse();
            assertThat(config.catalog()).isNull();
        }
    }

    @Nested
    @DisplayName("Unset values")
    class UnsetValues {

        @Test
        void blankValuesAreIgnored() {
            envVars.put("FORMULAKIT_CATALOG", "");
            envVars.put("FORMULAKIT_RANDOM_SEED", "   ");
            envVars.put("LOG_LEVEL", "\t");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.catalog()).isEqualTo("/opt/formulakit/catalog.yaml");
            assertThat(config.randomSeed()).isEqualTo(42L);
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        void invalidSeedIsRejected() {
            envVars.put("FORMULAKIT_RANDOM_SEED", "abc");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("FORMULAKIT_RANDOM_SEED")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }
    }
}

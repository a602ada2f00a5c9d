package fr.lapetina.airouting.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("should load the configuration from the classpath")
        void shouldLoadFromClasspath() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                RoutingConfig config = loader.load();

                assertThat(config.getProviders()).extracting(RoutingConfig.ProviderConfig::getId)
                        .containsExactly("alpha", "beta", "gamma");
                assertThat(config.getProviders().get(0).getModels()).containsExactly("alpha-large", "alpha-small");
                assertThat(config.getMonitoring().getMaxOperationHistory()).isEqualTo(500);
                assertThat(config.getLoadBalancing().getRandomSeed()).isEqualTo(42L);
                assertThat(config.getJournal().getRingBufferSize()).isEqualTo(64);
                assertThat(loader.getCurrentConfig()).isSameAs(config);
            }
        }

        @Test
        @DisplayName("should accept integer and decimal weights")
        void shouldReadWeights() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                RoutingConfig.LoadBalancingConfig lb = loader.load().getLoadBalancing();

                assertThat(lb.weightFor("alpha", 1.0)).isEqualTo(2.0);
                assertThat(lb.weightFor("gamma", 1.0)).isEqualTo(0.5);
                assertThat(lb.weightFor("unknown", 1.0)).isEqualTo(1.0);
            }
        }

        @Test
        @DisplayName("should keep defaults for omitted sections")
        void shouldKeepDefaults() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                RoutingConfig config = loader.load();

                assertThat(config.getMonitoring().getCollectionIntervalMs()).isEqualTo(10_000);
                assertThat(config.getMonitoring().getReservoirCapacity()).isEqualTo(200);
                assertThat(config.getLoadBalancing().getAssumedCapacity()).isEqualTo(20);
                assertThat(config.getServices()).hasSize(4);
            }
        }

        @Test
        @DisplayName("should fall back to defaults for an empty document")
        void shouldLoadEmptyDocument() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
                RoutingConfig config = loader.loadFromStream(yaml(""));

                assertThat(config.getProviders()).isEmpty();
                assertThat(config.getLoadBalancing().getAlgorithm()).isEqualTo("performance_based");
            }
        }

        @Test
        @DisplayName("should reject a configuration violating constraints")
        void shouldRejectInvalidConfiguration() {
            try (ConfigLoader loader = new ConfigLoader("invalid-config.yaml")) {
                assertThatThrownBy(loader::load).isInstanceOf(ConfigLoader.ConfigurationException.class);
            }
        }

        @Test
        @DisplayName("should reject duplicate provider ids")
        void shouldRejectDuplicateIds() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
                assertThatThrownBy(() -> loader.loadFromStream(yaml("providers:\n  - id: a\n  - id: a\n")))
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("Duplicate provider id: a");
            }
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
                assertThatThrownBy(() -> loader.loadFromStream(yaml("providers: [unclosed")))
                        .isInstanceOf(ConfigLoader.ConfigurationException.class);
            }
        }

        @Test
        @DisplayName("should fail when the file exists nowhere")
        void shouldFailOnMissingFile() {
            try (ConfigLoader loader = new ConfigLoader("does-not-exist.yaml")) {
                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("not found");
            }
        }
    }

    @Nested
    @DisplayName("Reloading")
    class ReloadTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyOnReload() throws IOException {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, "loadBalancing:\n  algorithm: weighted\n");
            List<String> changes = new ArrayList<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                loader.addListener((oldConfig, newConfig) -> changes.add(
                        (oldConfig == null ? "none" : oldConfig.getLoadBalancing().getAlgorithm())
                                + "->" + newConfig.getLoadBalancing().getAlgorithm()));
                loader.load();

                Files.writeString(file, "loadBalancing:\n  algorithm: round_robin\n");
                RoutingConfig reloaded = loader.reload();

                assertThat(reloaded.getLoadBalancing().getAlgorithm()).isEqualTo("round_robin");
                assertThat(changes).containsExactly("none->weighted", "weighted->round_robin");
            }
        }

        @Test
        @DisplayName("should keep the current configuration when a reload fails")
        void shouldKeepCurrentOnFailure() throws IOException {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, "loadBalancing:\n  algorithm: weighted\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                RoutingConfig original = loader.load();

                Files.writeString(file, "health:\n  degradedThreshold: 9\n  unhealthyThreshold: 1\n");
                RoutingConfig afterReload = loader.reload();

                assertThat(afterReload).isSameAs(original);
                assertThat(loader.getCurrentConfig()).isSameAs(original);
            }
        }
    }
}

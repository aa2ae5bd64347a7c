package im.arun.outline.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    void readsBundledDefaults() {
        OutlineConfig config = new ConfigLoader().load();

        assertThat(config.getMaxLines()).isEqualTo(200);
        assertThat(config.getMinGroupSize()).isEqualTo(3);
        assertThat(config.getTextTruncateLength()).isEqualTo(50);
        assertThat(config.getMaxRefsInSummary()).isEqualTo(5);
        assertThat(config.getMaxTokens()).isEqualTo(20000);
        assertThat(config.isApplyTokenLimit()).isFalse();
    }

    @Test
    void userOptionsOverrideDefaults() {
        Map<String, Object> options = new HashMap<>();
        options.put("max_lines", 40);
        options.put("minGroupSize", "5");
        options.put("apply_token_limit", "yes");
        options.put("colour", "blue");

        OutlineConfig config = new ConfigLoader().load(options);

        assertThat(config.getMaxLines()).isEqualTo(40);
        assertThat(config.getMinGroupSize()).isEqualTo(5);
        assertThat(config.isApplyTokenLimit()).isTrue();
        assertThat(config.getSampleChildren()).isEqualTo(3);
    }

    @Test
    void overridesDoNotLeakIntoLaterLoads() {
        ConfigLoader loader = new ConfigLoader();
        Map<String, Object> options = new HashMap<>();
        options.put("maxLines", 10);

        loader.load(options);

        assertThat(loader.load().getMaxLines()).isEqualTo(200);
    }

    @Test
    void rejectsNonNumericValue() {
        Map<String, Object> options = new HashMap<>();
        options.put("max_lines", "many");

        assertThatThrownBy(() -> new ConfigLoader().load(options))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max_lines");
    }

    @Test
    void explicitFileWins(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("outline.yaml");
        Files.writeString(file, "maxLines: 25\nminGroupSize: 4\nunknownSetting: true\n");

        OutlineConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getMaxLines()).isEqualTo(25);
        assertThat(config.getMinGroupSize()).isEqualTo(4);
        assertThat(config.getTextTruncateLength()).isEqualTo(50);
    }

    @Test
    void missingFileFallsBackToBundledConfig(@TempDir Path dir) {
        OutlineConfig config = new ConfigLoader(dir.resolve("absent.yaml").toString()).load();

        assertThat(config.getMaxLines()).isEqualTo(200);
    }

    @Test
    void validationNamesOffendingSetting() {
        OutlineConfig config = new OutlineConfig();
        config.setMinGroupSize(2);

        assertThatThrownBy(config::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("minGroupSize must be at least 3: 2");
    }
}

package com.wear.stitch.service;

import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.core.stitcher.CompositeOptions;
import com.wear.stitch.dto.StitchSettings;
import com.wear.stitch.dto.StitchSettingsRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StitchConfigServiceTest {

    @TempDir
    Path dataDir;

    private YamlConfig yamlConfig;

    @BeforeEach
    void setUp() {
        yamlConfig = new YamlConfig();
        yamlConfig.getSystem().setDataDir(dataDir.toString());
    }

    private StitchConfigService newService() {
        StitchConfigService service = new StitchConfigService();
        ReflectionTestUtils.setField(service, "yamlConfig", yamlConfig);
        service.init();
        return service;
    }

    @Test
    @DisplayName("Should start from the application.yml defaults")
    void init_NoConfigFile_UsesDefaults() {
        StitchSettings settings = newService().getSettings();

        assertThat(settings.isRound()).isTrue();
        assertThat(settings.isTransparency()).isFalse();
        assertThat(settings.isParallel()).isFalse();
    }

    @Test
    @DisplayName("Should persist changes and reload them on the next start")
    void update_PersistsAcrossRestart() {
        StitchSettingsRequest request = new StitchSettingsRequest();
        request.setTransparency(true);

        StitchSettings updated = newService().update(request);

        assertThat(updated.isTransparency()).isTrue();
        assertThat(updated.isRound()).isTrue();
        assertThat(dataDir.resolve("stitch-config.json")).exists();

        StitchSettings reloaded = newService().getSettings();
        assertThat(reloaded).isEqualTo(new StitchSettings(true, true, false));
    }

    @Test
    @DisplayName("Should return a copy that callers cannot use to change the settings")
    void getSettings_ReturnsCopy() {
        StitchConfigService service = newService();

        service.getSettings().setRound(false);

        assertThat(service.getSettings().isRound()).isTrue();
    }

    @Test
    @DisplayName("Should let per-request values override the stored settings")
    void createStrategy_RequestOverrides() {
        StitchConfigService service = newService();

        CompositeOptions defaults = service.createStrategy(null, null).getOptions();
        CompositeOptions overridden = service.createStrategy(false, true).getOptions();

        assertThat(defaults.isCircularMask()).isTrue();
        assertThat(defaults.isTransparency()).isFalse();
        assertThat(overridden.isCircularMask()).isFalse();
        assertThat(overridden.isTransparency()).isTrue();
    }

    @Test
    @DisplayName("Should expose stitching and capture settings together")
    @SuppressWarnings("unchecked")
    void getAllConfigs_IncludesCaptureDefaults() {
        Map<String, Object> configs = newService().getAllConfigs();

        assertThat(configs).containsEntry("round", true).containsKey("configFilePath");
        Map<String, Object> capture = (Map<String, Object>) configs.get("capture");
        assertThat(capture).containsEntry("maxCaptures", 50).containsEntry("filePrefix", "stitch");
    }
}

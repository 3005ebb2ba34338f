package com.referenceextraction;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigJUnitTest {

    @Test
    void load_readsBundledDefaults() {
        ExtractionConfig config = ExtractionConfig.load();

        assertEquals(0.3, config.minConfidenceThreshold(), 1e-9);
        assertEquals(20, config.minReferenceLength());
        assertEquals(50, config.maxFileSizeMb());
        assertEquals(TextExtractionArbiter.DEFAULT_QUALITY_INDICATORS, config.qualityIndicators());
        assertEquals(List.of("json", "csv", "txt", "md", "bib"), config.outputFormats());
        assertEquals("tesseract", config.ocrCommand());
        assertEquals(1, config.batchParallelism());
    }

    @Test
    void fromProperties_overridesOnlyGivenKeys() {
        Properties props = new Properties();
        props.setProperty("extraction.min-confidence-threshold", "0.5");
        props.setProperty("ocr.enabled", "no");
        props.setProperty("output.formats", " json , bib ");

        ExtractionConfig config = ExtractionConfig.fromProperties(props);

        assertEquals(0.5, config.minConfidenceThreshold(), 1e-9);
        assertFalse(config.ocrEnabled());
        assertEquals(List.of("json", "bib"), config.outputFormats());
        assertEquals(ExtractionConfig.defaults().minReferenceLength(), config.minReferenceLength());
        assertEquals(300f, config.ocrDpi());
    }

    @Test
    void fromProperties_invalidNumberNamesTheKey() {
        Properties props = new Properties();
        props.setProperty("batch.parallelism", "many");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExtractionConfig.fromProperties(props));
        assertTrue(e.getMessage().contains("batch.parallelism"));
    }

    @Test
    void constructor_rejectsThresholdOutsideUnitInterval() {
        ExtractionConfig defaults = ExtractionConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withMinConfidenceThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> defaults.withBatchParallelism(0));
    }

    @Test
    void withers_returnModifiedCopies() {
        ExtractionConfig defaults = ExtractionConfig.defaults();
        ExtractionConfig changed = defaults.withMinConfidenceThreshold(0.7).withOutputFormats(List.of("md"));

        assertEquals(0.7, changed.minConfidenceThreshold(), 1e-9);
        assertEquals(List.of("md"), changed.outputFormats());
        assertEquals(0.3, defaults.minConfidenceThreshold(), 1e-9);
    }
}

package com.gearprice.common.classifier;

import com.gearprice.common.model.InstrumentCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentCategoryClassifierTest {

    @Test
    @DisplayName("bass is detected before guitar")
    void bassFirst() {
        assertEquals(InstrumentCategory.BASS_GUITAR, InstrumentCategoryClassifier.classify("fender jazz bass guitar"));
    }

    @Test
    @DisplayName("guitar sub-types")
    void guitars() {
        assertEquals(InstrumentCategory.ELECTRIC_GUITAR, InstrumentCategoryClassifier.classify("fender stratocaster"));
        assertEquals(InstrumentCategory.ACOUSTIC_GUITAR, InstrumentCategoryClassifier.classify("martin d-28 acoustic guitar"));
        assertEquals(InstrumentCategory.GUITAR,          InstrumentCategoryClassifier.classify("gibson guitar"));
    }

    @Test
    @DisplayName("gear categories")
    void gear() {
        assertEquals(InstrumentCategory.EFFECTS_PEDAL, InstrumentCategoryClassifier.classify("boss ds-1 distortion pedal"));
        assertEquals(InstrumentCategory.AMPLIFIER,     InstrumentCategoryClassifier.classify("fender blues junior amp"));
        assertEquals(InstrumentCategory.UKULELE,       InstrumentCategoryClassifier.classify("kala concert ukulele"));
        assertEquals(InstrumentCategory.RESONATOR,     InstrumentCategoryClassifier.classify("national resonator"));
    }

    @Test
    @DisplayName("keywords only match whole words")
    void wholeWords() {
        assertEquals(InstrumentCategory.OTHER, InstrumentCategoryClassifier.classify("sgt pepper poster"));
        assertEquals(InstrumentCategory.OTHER, InstrumentCategoryClassifier.classify("bassoon reed"));
    }

    @Test
    @DisplayName("blank description → OTHER")
    void blank() {
        assertEquals(InstrumentCategory.OTHER, InstrumentCategoryClassifier.classify(" "));
        assertEquals(InstrumentCategory.OTHER, InstrumentCategoryClassifier.classify(null));
    }
}

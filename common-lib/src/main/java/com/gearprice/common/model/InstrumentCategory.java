package com.gearprice.common.model;

/**
 * Coarse instrument grouping attached to every {@link ConsensusResult} for the
 * reporting layers. Derived from description keywords by
 * {@link com.gearprice.common.classifier.InstrumentCategoryClassifier}.
 */
public enum InstrumentCategory {
    ELECTRIC_GUITAR("Electric Guitar"),
    ACOUSTIC_GUITAR("Acoustic Guitar"),
    GUITAR("Guitar"),
    BASS_GUITAR("Bass Guitar"),
    UKULELE("Ukulele"),
    MANDOLIN("Mandolin"),
    PERCUSSION("Percussion"),
    EFFECTS_PEDAL("Effects Pedal"),
    AMPLIFIER("Amplifier"),
    RESONATOR("Resonator"),
    OTHER("Other Instrument");

    private final String label;

    InstrumentCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

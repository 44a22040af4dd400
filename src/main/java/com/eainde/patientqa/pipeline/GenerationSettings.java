package com.eainde.patientqa.pipeline;

/**
 * @param retrievalTopK   number of chunks requested from the index per turn
 * @param fallbackMessage answer used when generation fails; must tell the user to seek care
 */
public record GenerationSettings(int retrievalTopK, String fallbackMessage) {

    public static final String DEFAULT_FALLBACK =
            "I'm sorry, I'm not able to answer right now. If you are worried about your symptoms, "
                    + "please contact your doctor, and if you have heavy bleeding, feel faint or are in "
                    + "a lot of pain, seek urgent medical care.";

    public GenerationSettings {
        if (retrievalTopK < 0) throw new IllegalArgumentException("retrievalTopK must be >= 0");
        if (fallbackMessage == null || fallbackMessage.isBlank()) {
            fallbackMessage = DEFAULT_FALLBACK;
        }
    }
}

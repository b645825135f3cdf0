package com.autoprof.orchestrator.step;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Step names and the two default "head" sequences.
 *
 * The standard sequence fits the isophotes itself; the forced sequence reuses
 * geometry supplied from a previous fit and skips the fit-quality check.
 */
public final class BuiltinSequences {

    public static final String BACKGROUND              = "background";
    public static final String PSF                     = "psf";
    public static final String CENTER                  = "center";
    public static final String CENTER_FORCED           = "center forced";
    public static final String ISOPHOTE_INIT           = "isophoteinit";
    public static final String ISOPHOTE_FIT            = "isophotefit";
    public static final String ISOPHOTE_FIT_FORCED     = "isophotefit forced";
    public static final String ISOPHOTE_EXTRACT        = "isophoteextract";
    public static final String ISOPHOTE_EXTRACT_FORCED = "isophoteextract forced";
    public static final String CHECK_FIT               = "checkfit";
    public static final String WRITE_PROFILE           = "writeprof";

    public static final List<String> STANDARD = List.of(
            BACKGROUND, PSF, CENTER, ISOPHOTE_INIT,
            ISOPHOTE_FIT, ISOPHOTE_EXTRACT, CHECK_FIT, WRITE_PROFILE);

    public static final List<String> FORCED = List.of(
            BACKGROUND, PSF, CENTER_FORCED,
            ISOPHOTE_FIT_FORCED, ISOPHOTE_EXTRACT_FORCED, WRITE_PROFILE);

    private BuiltinSequences() {}

    /** Every step name the two built-in sequences refer to, in first-seen order. */
    public static Set<String> referencedStepNames() {
        Set<String> names = new LinkedHashSet<>(STANDARD);
        names.addAll(FORCED);
        return names;
    }
}

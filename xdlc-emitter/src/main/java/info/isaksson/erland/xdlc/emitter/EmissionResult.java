package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.classify.AbiClassification;

import java.util.List;

/** Rendered artifacts of one emission; nothing has been written to disk yet. */
public final class EmissionResult {

    /** {@code <stem>.g.h} */
    public final String headerFileName;
    public final String headerText;

    /** {@code impls_<stem>.g.h}, or {@code null} when stubs were not requested. */
    public final String stubsFileName;
    public final String stubsText;

    /** Union of breakpoints of the root declarations, ascending. */
    public final List<String> breakpoints;

    public final AbiClassification classification;
    public final List<EmitterWarning> warnings;

    public EmissionResult(
            String headerFileName,
            String headerText,
            String stubsFileName,
            String stubsText,
            List<String> breakpoints,
            AbiClassification classification,
            List<EmitterWarning> warnings
    ) {
        this.headerFileName = headerFileName;
        this.headerText = headerText;
        this.stubsFileName = stubsFileName;
        this.stubsText = stubsText;
        this.breakpoints = breakpoints == null ? List.of() : List.copyOf(breakpoints);
        this.classification = classification;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasStubs() {
        return stubsText != null;
    }
}

package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.ParamFormat;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Highlighting: matched-term snippets per document and field.
 *
 * <p>Flattens to {@code hl=true} plus {@code hl.*} options. {@code hl.fl} is sent
 * comma-joined.</p>
 */
public final class HighlightConfig extends AbstractFeatureConfig {

    public static final String ENABLE_KEY = "hl";

    private final @Nullable Method method;
    private final @Nullable List<String> fields;
    private final @Nullable String query;
    private final @Nullable String queryParser;
    private final @Nullable Boolean requireFieldMatch;
    private final @Nullable Boolean usePhraseHighlighter;
    private final @Nullable Boolean highlightMultiTerm;
    private final @Nullable Integer snippets;
    private final @Nullable Integer fragsize;
    private final @Nullable Encoder encoder;
    private final @Nullable Integer maxAnalyzedChars;
    private final @Nullable String tagPre;
    private final @Nullable String tagPost;
    private final @Nullable String tagEllipsis;
    private final @Nullable Boolean defaultSummary;
    private final @Nullable BreakIterator breakIterator;
    private final @Nullable String breakLanguage;
    private final @Nullable String breakCountry;
    private final @Nullable String breakSeparator;
    private final @Nullable Boolean weightMatches;
    private final @Nullable String alternateField;
    private final @Nullable Integer maxAlternateFieldLength;
    private final @Nullable Fragmenter fragmenter;
    private final @Nullable String simplePre;
    private final @Nullable String simplePost;
    private final @Nullable Boolean mergeContiguous;
    private final @Nullable Boolean preserveMulti;

    private HighlightConfig(Builder builder) {
        super(ENABLE_KEY);
        this.method = builder.method;
        this.fields = ParamChecks.copyTexts(builder.fields, "Highlight field");
        this.query = builder.query;
        this.queryParser = builder.queryParser;
        this.requireFieldMatch = builder.requireFieldMatch;
        this.usePhraseHighlighter = builder.usePhraseHighlighter;
        this.highlightMultiTerm = builder.highlightMultiTerm;
        this.snippets = builder.snippets;
        this.fragsize = builder.fragsize;
        this.encoder = builder.encoder;
        this.maxAnalyzedChars = builder.maxAnalyzedChars;
        this.tagPre = builder.tagPre;
        this.tagPost = builder.tagPost;
        this.tagEllipsis = builder.tagEllipsis;
        this.defaultSummary = builder.defaultSummary;
        this.breakIterator = builder.breakIterator;
        this.breakLanguage = builder.breakLanguage;
        this.breakCountry = builder.breakCountry;
        this.breakSeparator = builder.breakSeparator;
        this.weightMatches = builder.weightMatches;
        this.alternateField = builder.alternateField;
        this.maxAlternateFieldLength = builder.maxAlternateFieldLength;
        this.fragmenter = builder.fragmenter;
        this.simplePre = builder.simplePre;
        this.simplePost = builder.simplePost;
        this.mergeContiguous = builder.mergeContiguous;
        this.preserveMulti = builder.preserveMulti;

        ParamChecks.requirePositive(snippets, "hl.snippets");
        ParamChecks.requireNonNegative(fragsize, "hl.fragsize");
        ParamChecks.requireNonNegative(maxAnalyzedChars, "hl.maxAnalyzedChars");
        ParamChecks.requireNonNegative(maxAlternateFieldLength, "hl.maxAlternateFieldLength");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void contribute(WireParams.Builder params) {
        option(params, "method", method);
        option(params, "fl", fields == null || fields.isEmpty() ? null : ParamFormat.commaJoin(fields));
        option(params, "q", query);
        option(params, "qparser", queryParser);
        option(params, "requireFieldMatch", requireFieldMatch);
        option(params, "usePhraseHighlighter", usePhraseHighlighter);
        option(params, "highlightMultiTerm", highlightMultiTerm);
        option(params, "snippets", snippets);
        option(params, "fragsize", fragsize);
        option(params, "encoder", encoder);
        option(params, "maxAnalyzedChars", maxAnalyzedChars);
        option(params, "tag.pre", tagPre);
        option(params, "tag.post", tagPost);
        option(params, "tag.ellipsis", tagEllipsis);
        option(params, "defaultSummary", defaultSummary);
        option(params, "bs.type", breakIterator);
        option(params, "bs.language", breakLanguage);
        option(params, "bs.country", breakCountry);
        option(params, "bs.separator", breakSeparator);
        option(params, "weightMatches", weightMatches);
        option(params, "alternateField", alternateField);
        option(params, "maxAlternateFieldLength", maxAlternateFieldLength);
        option(params, "fragmenter", fragmenter);
        option(params, "simple.pre", simplePre);
        option(params, "simple.post", simplePost);
        option(params, "mergeContiguous", mergeContiguous);
        option(params, "preserveMulti", preserveMulti);
    }

    public @Nullable List<String> fields() {
        return fields;
    }

    public enum Method implements WireValue {
        UNIFIED("unified"),
        ORIGINAL("original"),
        FAST_VECTOR("fastVector");

        private final String wireValue;

        Method(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public enum Encoder implements WireValue {
        /** Snippet text as stored. */
        PLAIN(""),
        /** HTML-escape snippet text, except the highlight tags. */
        HTML("html");

        private final String wireValue;

        Encoder(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    /**
     * Unified highlighter passage boundaries.
     */
    public enum BreakIterator implements WireValue {
        SEPARATOR("SEPARATOR"),
        SENTENCE("SENTENCE"),
        WORD("WORD"),
        CHARACTER("CHARACTER"),
        LINE("LINE"),
        WHOLE("WHOLE");

        private final String wireValue;

        BreakIterator(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    /**
     * Original highlighter snippet generator.
     */
    public enum Fragmenter implements WireValue {
        GAP("gap"),
        REGEX("regex");

        private final String wireValue;

        Fragmenter(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public static class Builder {
        private @Nullable Method method;
        private @Nullable List<String> fields;
        private @Nullable String query;
        private @Nullable String queryParser;
        private @Nullable Boolean requireFieldMatch;
        private @Nullable Boolean usePhraseHighlighter;
        private @Nullable Boolean highlightMultiTerm;
        private @Nullable Integer snippets;
        private @Nullable Integer fragsize;
        private @Nullable Encoder encoder;
        private @Nullable Integer maxAnalyzedChars;
        private @Nullable String tagPre;
        private @Nullable String tagPost;
        private @Nullable String tagEllipsis;
        private @Nullable Boolean defaultSummary;
        private @Nullable BreakIterator breakIterator;
        private @Nullable String breakLanguage;
        private @Nullable String breakCountry;
        private @Nullable String breakSeparator;
        private @Nullable Boolean weightMatches;
        private @Nullable String alternateField;
        private @Nullable Integer maxAlternateFieldLength;
        private @Nullable Fragmenter fragmenter;
        private @Nullable String simplePre;
        private @Nullable String simplePost;
        private @Nullable Boolean mergeContiguous;
        private @Nullable Boolean preserveMulti;

        public Builder method(Method method) {
            this.method = method;
            return this;
        }

        public Builder fields(String... fields) {
            this.fields = Arrays.asList(fields);
            return this;
        }

        /**
         * Query to highlight, when it differs from the main {@code q}.
         */
        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder queryParser(String queryParser) {
            this.queryParser = queryParser;
            return this;
        }

        public Builder requireFieldMatch(boolean requireFieldMatch) {
            this.requireFieldMatch = requireFieldMatch;
            return this;
        }

        public Builder usePhraseHighlighter(boolean usePhraseHighlighter) {
            this.usePhraseHighlighter = usePhraseHighlighter;
            return this;
        }

        public Builder highlightMultiTerm(boolean highlightMultiTerm) {
            this.highlightMultiTerm = highlightMultiTerm;
            return this;
        }

        public Builder snippets(int snippets) {
            this.snippets = snippets;
            return this;
        }

        /**
         * Approximate snippet length in characters; {@code 0} highlights the whole field.
         */
        public Builder fragsize(int fragsize) {
            this.fragsize = fragsize;
            return this;
        }

        public Builder encoder(Encoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder maxAnalyzedChars(int maxAnalyzedChars) {
            this.maxAnalyzedChars = maxAnalyzedChars;
            return this;
        }

        public Builder tags(String pre, String post) {
            this.tagPre = pre;
            this.tagPost = post;
            return this;
        }

        public Builder tagEllipsis(String tagEllipsis) {
            this.tagEllipsis = tagEllipsis;
            return this;
        }

        public Builder defaultSummary(boolean defaultSummary) {
            this.defaultSummary = defaultSummary;
            return this;
        }

        public Builder breakIterator(BreakIterator breakIterator) {
            this.breakIterator = breakIterator;
            return this;
        }

        public Builder breakLanguage(String breakLanguage) {
            this.breakLanguage = breakLanguage;
            return this;
        }

        public Builder breakCountry(String breakCountry) {
            this.breakCountry = breakCountry;
            return this;
        }

        public Builder breakSeparator(String breakSeparator) {
            this.breakSeparator = breakSeparator;
            return this;
        }

        public Builder weightMatches(boolean weightMatches) {
            this.weightMatches = weightMatches;
            return this;
        }

        public Builder alternateField(String alternateField) {
            this.alternateField = alternateField;
            return this;
        }

        public Builder maxAlternateFieldLength(int maxAlternateFieldLength) {
            this.maxAlternateFieldLength = maxAlternateFieldLength;
            return this;
        }

        public Builder fragmenter(Fragmenter fragmenter) {
            this.fragmenter = fragmenter;
            return this;
        }

        public Builder simpleTags(String pre, String post) {
            this.simplePre = pre;
            this.simplePost = post;
            return this;
        }

        public Builder mergeContiguous(boolean mergeContiguous) {
            this.mergeContiguous = mergeContiguous;
            return this;
        }

        public Builder preserveMulti(boolean preserveMulti) {
            this.preserveMulti = preserveMulti;
            return this;
        }

        public HighlightConfig build() {
            return new HighlightConfig(this);
        }
    }
}

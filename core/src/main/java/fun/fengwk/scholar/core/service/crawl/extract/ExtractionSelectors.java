package fun.fengwk.scholar.core.service.crawl.extract;

import java.util.List;

/**
 * Selector candidates for Scholar profile and paper pages, most specific first.
 *
 * @author fengwk
 */
public final class ExtractionSelectors {

    private ExtractionSelectors() {}

    public static final List<String> SUBJECT_NAME = List.of(
        "#gsc_prf_in",
        ".gsc_prf_in",
        "h1",
        ".gs_ai_name"
    );

    public static final String TITLE_SEPARATOR = " - ";

    public static final List<String> SORT_BY_YEAR = List.of(
        "#gsc_a_ha",
        "button[aria-label*='Sort']",
        ".gsc_a_ha",
        "//a[contains(normalize-space(.), 'Year')]",
        "//span[contains(normalize-space(.), 'Year')]/parent::*"
    );

    public static final List<String> SHOW_MORE = List.of(
        "#gsc_bpf_more",
        "button[onclick*='more']",
        ".gsc_bpf_more",
        "//button[contains(normalize-space(.), 'Show more')]",
        "//span[contains(normalize-space(.), 'Show more')]/parent::button"
    );

    public static final List<String> PAPER_ROWS = List.of(
        ".gsc_a_tr",
        "tr.gsc_a_tr",
        ".gs_r.gs_or.gs_scl",
        ".gsc_a_t"
    );

    public static final List<String> PAPER_ROW_LINK = List.of(
        "a.gsc_a_at",
        ".gsc_a_at",
        "a"
    );

    public static final List<String> TITLE = List.of(
        "#gsc_oci_title a",
        "#gsc_oci_title",
        ".gs_rt h3 a",
        ".gs_rt a",
        "h1",
        ".citation_title"
    );

    public static final String BYLINE = ".gs_a";

    public static final List<String> AUTHORS = List.of(
        detailField("Authors"),
        detailField("Inventors"),
        BYLINE,
        ".citation_author",
        ".authors",
        ".author"
    );

    public static final List<String> PUBLICATION_DATE = List.of(
        detailField("Publication date"),
        BYLINE,
        ".citation_date",
        ".year",
        ".date"
    );

    public static final List<String> ARTIFACT_LINKS = List.of(
        "#gsc_oci_title_gg a",
        "a[href*='.pdf']",
        ".gs_or_ggsm a",
        ".citation_pdf_url",
        "a[href*='doi.org']",
        "a[href*='arxiv.org']"
    );

    public static final List<String> CITATIONS = List.of(
        detailField("Total citations"),
        ".gs_fl a[href*='cites']",
        ".citation_count",
        "a[href*='cited']"
    );

    public static final String JOURNAL_FIELD = detailField("Journal");

    public static final String CONFERENCE_FIELD = detailField("Conference");

    public static final List<String> SOURCE_FIELDS = List.of(
        detailField("Source"),
        detailField("Book"),
        detailField("Publisher")
    );

    public static final List<String> VENUE_FALLBACKS = List.of(
        ".citation_venue",
        ".journal",
        ".conference"
    );

    public static final List<String> SUMMARY = List.of(
        detailField("Description"),
        "#gsc_oci_descr",
        ".gs_rs",
        ".citation_abstract",
        ".abstract",
        ".description"
    );

    /**
     * XPath of the value cell next to a labelled field of the Scholar citation detail page.
     */
    public static String detailField(String label) {
        return "//div[contains(@class, 'gsc_oci_field')][normalize-space(.) = '" + label + "']"
            + "/following-sibling::div[contains(@class, 'gsc_oci_value')]";
    }

}

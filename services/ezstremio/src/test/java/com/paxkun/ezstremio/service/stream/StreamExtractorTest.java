package com.paxkun.ezstremio.service.stream;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamExtractorTest {

    private static final String DETAILS_PAGE = "<html>\n"
            + "<body>\n"
            + "  <ul class=\"video__info\">\n"
            + "    <li><span>Délka:</span><span>2:40:12</span></li>\n"
            + "    <li><span>Rozlišení:</span><span> 1920 x 1080 px </span></li>\n"
            + "  </ul>\n"
            + "  <script>\n"
            + "    var player = null;\n"
            + "    var sources = [\n"
            + "      { file: \"https://cdn.prehraj.to/v/abc-720.mp4?token=1\", label: '720p', type: \"video/mp4\" },\n"
            + "      { file: 'https://cdn.prehraj.to/v/abc-1080.mp4?token=1', label: \"1080p\" },\n"
            + "      { file: \"https://cdn.prehraj.to/v/abc-raw.mp4\" }\n"
            + "    ];\n"
            + "    var tracks = [];\n"
            + "  </script>\n"
            + "</body>\n"
            + "</html>\n";

    private final StreamExtractor extractor = new StreamExtractor();

    @Test
    void extractsEverySourceWithItsLabel() {
        List<StreamDescriptor> streams = extractor.extract(DETAILS_PAGE);

        assertThat(streams).extracting(StreamDescriptor::address).containsExactly(
                "https://cdn.prehraj.to/v/abc-720.mp4?token=1",
                "https://cdn.prehraj.to/v/abc-1080.mp4?token=1",
                "https://cdn.prehraj.to/v/abc-raw.mp4");
        assertThat(streams).extracting(StreamDescriptor::label).containsExactly("720p", "1080p", "Unknown");
    }

    @Test
    void pageResolutionIsSharedByAllStreams() {
        List<StreamDescriptor> streams = extractor.extract(DETAILS_PAGE);

        assertThat(streams).allSatisfy(stream ->
                assertThat(stream.sourceResolutionHint()).isEqualTo("1920 x 1080 px"));
    }

    @Test
    void pageWithoutResolutionRowLeavesHintEmpty() {
        String page = "<script>var sources = [{ file: \"https://cdn/x.mp4\", label: '480p' }];</script>";

        List<StreamDescriptor> streams = extractor.extract(page);

        assertThat(streams).singleElement().satisfies(stream -> {
            assertThat(stream.label()).isEqualTo("480p");
            assertThat(stream.sourceResolutionHint()).isEmpty();
        });
    }

    @Test
    void pageWithoutSourceListYieldsNothing() {
        assertThat(extractor.extract("<html><body><p>Video bylo smazáno</p></body></html>")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void segmentsWithoutFileAreSkipped() {
        String page = "<script>var sources = [{ label: '720p' }, { file: \"https://cdn/y.mp4\" }];</script>";

        assertThat(extractor.extract(page)).extracting(StreamDescriptor::address).containsExactly("https://cdn/y.mp4");
    }
}

package com.tailorai.infrastructure.ai.render;

import com.tailorai.TestProfiles;
import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.resume.model.ExperienceEntry;
import com.tailorai.domain.tailor.model.ComposeResumeOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownResumeRendererTest {

    private MarkdownResumeRenderer renderer;
    private MarkdownProfileExtractor extractor;

    @BeforeEach
    void setUp() {
        renderer = new MarkdownResumeRenderer();
        extractor = new MarkdownProfileExtractor();
    }

    private static ComposeResumeOutput composed(CandidateProfile p) {
        return new ComposeResumeOutput(p.basics(), p.summary(), p.skills(), p.experience(),
                p.education(), p.projects(), p.community());
    }

    @Test
    @DisplayName("renders every section in order")
    void rendersSections() {
        String md = renderer.render(composed(TestProfiles.candidate()));

        assertThat(md).startsWith("# Jane Doe\njane@example.com | 555-0100 | Austin, TX\n");
        assertThat(md).contains("## Skills\nTechnical: Python, SQL, Docker\nTools: Git, Jira\nSoft: Communication\n");
        assertThat(md).contains("### Software Engineer - Acme Corp\n*Jan 2020 - Present* | Austin, TX\n"
                + "- Built ETL pipeline processing 2 million records daily\n");
        assertThat(md).contains("Relevant Coursework: Algorithms, Databases");
        assertThat(md).contains("## Community\n### Volunteer Mentor - Code for Good\n");
        assertThat(md.indexOf("## Summary")).isLessThan(md.indexOf("## Skills"));
        assertThat(md.indexOf("## Experience")).isLessThan(md.indexOf("## Education"));
    }

    @Test
    @DisplayName("entries marked as removed are not rendered")
    void removedEntriesHidden() {
        ExperienceEntry beta = TestProfiles.beta();
        ExperienceEntry removed = new ExperienceEntry(beta.title(), beta.company(), beta.startDate(),
                beta.endDate(), beta.location(), beta.bullets(), "Not relevant");
        CandidateProfile profile = TestProfiles.candidate().withExperience(List.of(TestProfiles.acme(), removed));

        String md = renderer.render(composed(profile));

        assertThat(md).doesNotContain("Beta Inc");
    }

    @Test
    @DisplayName("extracting the rendered markdown gives back the rendered profile")
    void extractRendered() {
        CandidateProfile source = TestProfiles.candidate();

        CandidateProfile extracted = extractor.extract(renderer.render(composed(source)));

        // certifications are not part of the tailored layout
        assertThat(extracted).isEqualTo(source.withCertifications(List.of()));
    }

    @Test
    @DisplayName("a title containing the heading separator keeps it")
    void titleWithSeparator() {
        ExperienceEntry acme = TestProfiles.acme();
        ExperienceEntry platform = new ExperienceEntry("Engineer - Platform", acme.company(), acme.startDate(),
                acme.endDate(), acme.location(), acme.bullets(), null);
        CandidateProfile source = TestProfiles.candidate().withExperience(List.of(platform));

        CandidateProfile extracted = extractor.extract(renderer.render(composed(source)));

        assertThat(extracted.experience()).singleElement().satisfies(e -> {
            assertThat(e.title()).isEqualTo("Engineer - Platform");
            assertThat(e.company()).isEqualTo("Acme Corp");
        });
    }

    @Test
    @DisplayName("unlabeled skill lines are read as technical skills")
    void unlabeledSkills() {
        CandidateProfile extracted = extractor.extract("# Jane\n\n## Skills\nPython, SQL\n");

        assertThat(extracted.skills().technical()).containsExactly("Python", "SQL");
        assertThat(extracted.basics().email()).isNull();
    }

    @Test
    @DisplayName("fallback uses accepted rewrites and caps skills and bullets")
    void fallback() {
        List<String> manyBullets = IntStream.range(0, 7).mapToObj(i -> "Rewritten bullet " + i).toList();
        CandidateProfile profile = TestProfiles.candidate();
        Map<String, List<String>> rewritten = Map.of(
                MarkdownResumeRenderer.bulletKey(TestProfiles.acme()), manyBullets);

        String md = renderer.renderFallback(profile, rewritten);

        assertThat(md).contains("## Skills\nPython, SQL, Docker, Git, Jira, Communication\n");
        assertThat(md).contains("- Rewritten bullet 4").doesNotContain("- Rewritten bullet 5");
        assertThat(md).contains("- Developed internal reporting tools for the finance team");
        assertThat(md).doesNotContain("Built ETL pipeline");
    }
}

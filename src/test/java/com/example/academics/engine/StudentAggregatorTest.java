package com.example.academics.engine;

import com.example.academics.engine.exception.UnknownGradingSystemException;
import com.example.academics.engine.model.MarkOutcome;
import com.example.academics.engine.model.MarkSnapshot;
import com.example.academics.engine.model.RawMark;
import com.example.academics.engine.model.StudentRef;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.model.SubjectComponent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudentAggregatorTest {

    private static final String TERM = "Term 1";
    private static final String END_TERM = "End Term";

    private final GradingVocabulary vocabulary = new GradingVocabulary(DefaultGradingSystems.all());
    private final StudentAggregator aggregator = new StudentAggregator(
            new MarkNormalizer(new SubjectModelResolver()), vocabulary, AggregationSettings.forSystem("CBC"));

    private final Subject maths = Subject.builder().id(1L).name("Mathematics").build();
    private final Subject english = Subject.builder().id(2L).name("English").composite(true)
            .component(SubjectComponent.builder().id(21L).name("Grammar").weight(0.5).maxRawScore(50).build())
            .component(SubjectComponent.builder().id(22L).name("Composition").weight(0.5).maxRawScore(40).build())
            .build();
    private final Subject science = Subject.builder().id(3L).name("Science").build();
    private final List<Subject> subjects = List.of(maths, english, science);

    private final StudentRef amina = StudentRef.builder().id(7L).name("Amina Otieno").stream("East").build();

    private static RawMark mark(Long subjectId, Long componentId, double raw, double max) {
        return RawMark.builder()
                .studentId(7L).subjectId(subjectId).componentId(componentId)
                .term(TERM).assessmentType(END_TERM)
                .rawScore(raw).maxRawScore(max)
                .build();
    }

    private final MarkSnapshot marks = MarkSnapshot.of(
            mark(1L, null, 80, 100),
            mark(2L, 21L, 40, 50),
            mark(2L, 22L, 30, 40));

    @Test
    void totalsExcludeMissingSubjects() {
        StudentResult result = aggregator.aggregate(amina, TERM, END_TERM, subjects, marks);

        // English: (80 + 75) / 2 = 77.5
        assertThat(result.outcomeFor(2L)).isEqualTo(MarkOutcome.of(77.5));
        assertThat(result.outcomeFor(3L).isMissing()).isTrue();
        assertThat(result.getTotalScore()).isEqualTo(157.5);
        assertThat(result.getTotalPossible()).isEqualTo(200.0);
        assertThat(result.getAveragePercentage()).isEqualTo(MarkOutcome.of(78.8));
        assertThat(result.getOverallGrade().getLabel()).isEqualTo("E.E");
        assertThat(result.getTotalPoints()).isEqualTo(8.0);
        assertThat(result.getRank()).isNull();
    }

    @Test
    void subjectScoresCarryGrades() {
        StudentResult result = aggregator.aggregate(amina, TERM, END_TERM, subjects, marks);

        assertThat(result.getSubjectScores()).containsOnlyKeys(1L, 2L, 3L);
        assertThat(result.getSubjectScores().get(1L).getGrade().getLabel()).isEqualTo("E.E");
        assertThat(result.getSubjectScores().get(3L).getGrade()).isNull();
    }

    @Test
    void aggregationIsIdempotent() {
        StudentResult first = aggregator.aggregate(amina, TERM, END_TERM, subjects, marks);
        StudentResult second = aggregator.aggregate(amina, TERM, END_TERM, subjects, marks);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void studentWithoutMarks() {
        StudentResult result = aggregator.aggregate(amina, TERM, END_TERM, subjects, MarkSnapshot.empty());

        assertThat(result.hasMarks()).isFalse();
        assertThat(result.getTotalScore()).isZero();
        assertThat(result.getTotalPossible()).isZero();
        assertThat(result.getAveragePercentage().isMissing()).isTrue();
        assertThat(result.getOverallGrade()).isNull();
    }

    @Test
    void totalsFollowAssessmentScale() {
        StudentAggregator cats = aggregator.withSettings(aggregator.getSettings().toBuilder()
                .assessmentScale(END_TERM, 30.0)
                .build());

        StudentResult result = cats.aggregate(amina, TERM, END_TERM, List.of(maths), marks);

        assertThat(result.getTotalScore()).isEqualTo(24.0);
        assertThat(result.getTotalPossible()).isEqualTo(30.0);
        assertThat(result.getAveragePercentage()).isEqualTo(MarkOutcome.of(80.0));
    }

    @Test
    void otherGradingSystem() {
        StudentAggregator letters = aggregator.withSettings(AggregationSettings.forSystem("LETTER"));

        StudentResult result = letters.aggregate(amina, TERM, END_TERM, subjects, marks);

        assertThat(result.getGradingSystem()).isEqualTo("LETTER");
        assertThat(result.getOverallGrade().getLabel()).isEqualTo("B+");
    }

    @Test
    void unknownActiveSystemFailsUpFront() {
        StudentAggregator broken = aggregator.withSettings(AggregationSettings.forSystem("KCSE"));

        assertThatThrownBy(() -> broken.aggregate(amina, TERM, END_TERM, subjects, marks))
                .isInstanceOf(UnknownGradingSystemException.class);
    }

    @Test
    void aggregateAllKeepsInputOrder() {
        StudentRef baraka = StudentRef.builder().id(8L).name("Baraka Mwangi").stream("East").build();

        List<StudentResult> results = aggregator.aggregateAll(List.of(baraka, amina), TERM, END_TERM, subjects, marks);

        assertThat(results).extracting(r -> r.getStudent().getId()).containsExactly(8L, 7L);
        assertThat(results.get(0).hasMarks()).isFalse();
        assertThat(results.get(1).hasMarks()).isTrue();
    }
}

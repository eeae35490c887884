package com.example.academics.engine;

import com.example.academics.engine.exception.InvalidMarkScaleException;
import com.example.academics.engine.exception.InvalidRawMarkException;
import com.example.academics.engine.model.MarkOutcome;
import com.example.academics.engine.model.MarkSnapshot;
import com.example.academics.engine.model.RawMark;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.model.SubjectScore;
import com.example.academics.engine.model.SubjectStructure;
import com.example.academics.engine.model.WeightedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns raw marks into subject percentages.
 * <p>
 * Missing-component policy: when a composite subject has marks for only some of its
 * components, the weights of the present components are re-normalized to sum to 1.0
 * and the absent ones are left out entirely. They are never counted as zero.
 * With no component marked at all the outcome is {@link MarkOutcome#missing()}.
 */
public class MarkNormalizer {

    private static final Logger log = LoggerFactory.getLogger(MarkNormalizer.class);

    private final SubjectModelResolver resolver;

    public MarkNormalizer(SubjectModelResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * raw / max * 100, rounded to one decimal.
     *
     * @throws InvalidMarkScaleException when max is not positive
     * @throws InvalidRawMarkException   when raw lies outside [0, max]
     */
    public static double percentage(double rawScore, double maxRawScore) {
        if (Double.isNaN(maxRawScore) || maxRawScore <= 0) {
            throw new InvalidMarkScaleException("Maximum raw mark must be positive, got " + maxRawScore);
        }
        if (Double.isNaN(rawScore) || rawScore < 0 || rawScore > maxRawScore) {
            throw new InvalidRawMarkException("Raw mark " + rawScore + " outside [0, " + maxRawScore + "]");
        }
        return ScoreRounding.round(rawScore / maxRawScore * 100.0);
    }

    public MarkOutcome normalize(MarkSnapshot marks, Long studentId, Subject subject, String term, String assessmentType) {
        return normalizeDetailed(marks, studentId, subject, term, assessmentType).getOutcome();
    }

    /**
     * Same as {@link #normalize} but keeps the per-component breakdown. The returned score carries no grade.
     */
    public SubjectScore normalizeDetailed(MarkSnapshot marks, Long studentId, Subject subject, String term, String assessmentType) {
        SubjectStructure structure = resolver.resolve(subject);
        List<WeightedComponent> parts = structure.isComposite()
                ? structure.getComponents()
                : List.of(new WeightedComponent(null, 1.0));

        SubjectScore.SubjectScoreBuilder score = SubjectScore.builder()
                .subjectId(subject.getId())
                .subjectName(subject.getName());

        double weighted = 0;
        double presentWeight = 0;
        for (WeightedComponent part : parts) {
            Optional<RawMark> mark = marks.find(studentId, subject.getId(), part.getComponentId(), term, assessmentType);
            if (mark.isEmpty()) {
                if (structure.isComposite()) {
                    score.missingComponentId(part.getComponentId());
                }
                continue;
            }
            double pct = percentage(mark.get().getRawScore(), mark.get().getMaxRawScore());
            weighted += pct * part.getWeight();
            presentWeight += part.getWeight();
            if (structure.isComposite()) {
                score.componentPercentage(part.getComponentId(), pct);
            }
        }

        if (presentWeight == 0) {
            return score.outcome(MarkOutcome.missing()).build();
        }
        if (structure.isComposite() && presentWeight < 1.0 - SubjectModelResolver.WEIGHT_EPSILON) {
            log.debug("Student {} subject {}: re-normalizing present component weight {} to 1.0",
                    studentId, subject.getName(), presentWeight);
        }
        return score.outcome(MarkOutcome.of(ScoreRounding.round(weighted / presentWeight))).build();
    }
}

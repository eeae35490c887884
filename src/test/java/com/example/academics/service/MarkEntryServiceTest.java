package com.example.academics.service;

import com.example.academics.config.AcademicsProperties;
import com.example.academics.dto.MarkEntryRequest;
import com.example.academics.engine.exception.InvalidMarkScaleException;
import com.example.academics.engine.exception.InvalidRawMarkException;
import com.example.academics.engine.model.EducationLevel;
import com.example.academics.entities.Mark;
import com.example.academics.entities.Student;
import com.example.academics.entities.SubjectComponentEntity;
import com.example.academics.entities.SubjectEntity;
import com.example.academics.repository.MarkRepository;
import com.example.academics.repository.SubjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MarkEntryServiceTest {

    private MarkRepository markRepository;
    private SubjectRepository subjectRepository;
    private StudentService studentService;
    private MarkEntryService service;

    private SubjectEntity maths;
    private SubjectEntity english;
    private SubjectComponentEntity grammar;

    @BeforeEach
    void setUp() {
        markRepository = Mockito.mock(MarkRepository.class);
        subjectRepository = Mockito.mock(SubjectRepository.class);
        studentService = Mockito.mock(StudentService.class);
        service = new MarkEntryService(markRepository, subjectRepository, studentService, new AcademicsProperties());

        Student student = Student.builder().id(1L).firstName("Amina").lastName("Otieno")
                .gradeLevel("Grade 5").stream("East").build();
        when(studentService.findById(1L)).thenReturn(Optional.of(student));

        maths = SubjectEntity.builder().id(10L).name("Mathematics")
                .educationLevel(EducationLevel.UPPER_PRIMARY).composite(false).build();
        english = SubjectEntity.builder().id(20L).name("English")
                .educationLevel(EducationLevel.UPPER_PRIMARY).composite(true).build();
        grammar = SubjectComponentEntity.builder().id(21L).name("Grammar").weight(0.5).maxRawScore(50).build();
        english.addComponent(grammar);
        english.addComponent(SubjectComponentEntity.builder().id(22L).name("Composition").weight(0.5).maxRawScore(40).build());

        when(subjectRepository.findById(10L)).thenReturn(Optional.of(maths));
        when(subjectRepository.findById(20L)).thenReturn(Optional.of(english));
        when(markRepository.saveAndFlush(any(Mark.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static MarkEntryRequest.MarkEntryRequestBuilder request() {
        return MarkEntryRequest.builder().studentId(1L).term("Term 1").assessmentType("End Term");
    }

    @Test
    void recordsAtomicMarkOnDefaultScale() {
        Mark saved = service.recordMark("teacher", request().subjectId(10L).rawScore(72.0).build());

        assertThat(saved.getComponentId()).isNull();
        assertThat(saved.getComponentKey()).isEqualTo(Mark.ATOMIC_COMPONENT_KEY);
        assertThat(saved.getRawScore()).isEqualTo(72.0);
        assertThat(saved.getMaxRawScore()).isEqualTo(100.0);
        assertThat(saved.getEnteredBy()).isEqualTo("teacher");
        assertThat(saved.getEnteredAt()).isNotNull();
    }

    @Test
    void componentMarkUsesComponentScale() {
        Mark saved = service.recordMark("teacher", request().subjectId(20L).componentId(21L).rawScore(45.0).build());

        assertThat(saved.getComponentId()).isEqualTo(21L);
        assertThat(saved.getComponentKey()).isEqualTo(21L);
        assertThat(saved.getMaxRawScore()).isEqualTo(50.0);
    }

    @Test
    void concurrentDuplicateInsertIsReportedAsBadRequest() {
        when(markRepository.saveAndFlush(any(Mark.class)))
                .thenThrow(new DataIntegrityViolationException("unique constraint"));

        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(10L).rawScore(72.0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already recorded")
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void existingMarkIsUpdated() {
        Mark existing = Mark.builder().id(99L).studentId(1L).subjectId(10L).term("Term 1").assessmentType("End Term")
                .rawScore(40).maxRawScore(100).enteredBy("someone").build();
        when(markRepository.findByStudentIdAndSubjectIdAndComponentKeyAndTermAndAssessmentType(
                1L, 10L, Mark.ATOMIC_COMPONENT_KEY, "Term 1", "End Term"))
                .thenReturn(Optional.of(existing));

        Mark saved = service.recordMark("teacher", request().subjectId(10L).rawScore(55.0).build());

        assertThat(saved.getId()).isEqualTo(99L);
        assertThat(saved.getRawScore()).isEqualTo(55.0);
        assertThat(saved.getEnteredBy()).isEqualTo("teacher");
    }

    @Test
    void rawAboveMaxIsRejectedNotClamped() {
        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(20L).componentId(21L).rawScore(51.0).build()))
                .isInstanceOf(InvalidRawMarkException.class);
        verify(markRepository, never()).saveAndFlush(any());
    }

    @Test
    void scaleMustBePositiveAndWithinLimit() {
        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(10L).rawScore(0.0).maxRawScore(0.0).build()))
                .isInstanceOf(InvalidMarkScaleException.class);
        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(10L).rawScore(10.0).maxRawScore(1001.0).build()))
                .isInstanceOf(InvalidMarkScaleException.class);
    }

    @Test
    void compositeSubjectNeedsOwnComponent() {
        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(20L).rawScore(30.0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(20L).componentId(77L).rawScore(30.0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not belong");
        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(10L).componentId(21L).rawScore(30.0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownTermOrAssessmentRejected() {
        assertThatThrownBy(() -> service.recordMark("teacher", request().term("Term 4").subjectId(10L).rawScore(30.0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Term 4");
        assertThatThrownBy(() -> service.recordMark("teacher", request().assessmentType("Quiz").subjectId(10L).rawScore(30.0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void subjectMustBeOfferedAtStudentsLevel() {
        SubjectEntity jssScience = SubjectEntity.builder().id(30L).name("Integrated Science")
                .educationLevel(EducationLevel.JUNIOR_SECONDARY).composite(false).build();
        when(subjectRepository.findById(30L)).thenReturn(Optional.of(jssScience));

        assertThatThrownBy(() -> service.recordMark("teacher", request().subjectId(30L).rawScore(30.0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not offered");
    }

    @Test
    void batchRecordsEveryMark() {
        List<Mark> saved = service.recordMarks("teacher", List.of(
                request().subjectId(20L).componentId(21L).rawScore(40.0).build(),
                request().subjectId(20L).componentId(22L).rawScore(30.0).build()));

        assertThat(saved).extracting(Mark::getComponentId).containsExactly(21L, 22L);
        assertThat(service.recordMarks("teacher", List.of())).isEmpty();
    }

    @Test
    void deleteUnknownMark() {
        when(markRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteMark(5L)).isInstanceOf(IllegalArgumentException.class);
    }
}

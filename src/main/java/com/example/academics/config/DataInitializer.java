package com.example.academics.config;

import com.example.academics.engine.model.EducationLevel;
import com.example.academics.entities.SubjectComponentEntity;
import com.example.academics.entities.SubjectEntity;
import com.example.academics.enums.UserRole;
import com.example.academics.repository.SubjectRepository;
import com.example.academics.service.AppUserService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the default staff accounts and the standard subject catalog if they are absent.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final AppUserService appUserService;
    private final SubjectRepository subjectRepo;

    public DataInitializer(AppUserService appUserService, SubjectRepository subjectRepo) {
        this.appUserService = appUserService;
        this.subjectRepo = subjectRepo;
    }

    @PostConstruct
    public void init() {
        createUserIfMissing("headteacher", "headteacher", UserRole.HEADTEACHER);
        createUserIfMissing("classteacher", "classteacher", UserRole.CLASS_TEACHER);
        createUserIfMissing("teacher", "teacher", UserRole.TEACHER);

        for (EducationLevel level : EducationLevel.values()) {
            int pos = 0;
            createIfMissing(level, "Mathematics", "MATH", pos++);
            createCompositeIfMissing(level, "English", "ENG", pos++,
                    component("Grammar", "GRAM", 0.5, 50),
                    component("Composition", "COMP", 0.5, 40));
            createCompositeIfMissing(level, "Kiswahili", "KISW", pos++,
                    component("Lugha", "LUGHA", 0.5, 50),
                    component("Insha", "INSHA", 0.5, 40));
            switch (level) {
                case LOWER_PRIMARY -> {
                    createIfMissing(level, "Environmental Activities", "ENV", pos++);
                    createIfMissing(level, "Creative Activities", "CA", pos);
                }
                case UPPER_PRIMARY -> {
                    createIfMissing(level, "Science and Technology", "SCI", pos++);
                    createIfMissing(level, "Social Studies", "SST", pos++);
                    createIfMissing(level, "Agriculture and Nutrition", "AGN", pos++);
                    createIfMissing(level, "Creative Arts", "CA", pos);
                }
                case JUNIOR_SECONDARY -> {
                    createIfMissing(level, "Integrated Science", "ISC", pos++);
                    createIfMissing(level, "Social Studies", "SST", pos++);
                    createIfMissing(level, "Pre-Technical Studies", "PTS", pos++);
                    createIfMissing(level, "Agriculture", "AGR", pos);
                }
            }
        }
        log.info("Subject catalog ready: {} subjects", subjectRepo.count());
    }

    private void createUserIfMissing(String username, String password, UserRole role) {
        if (appUserService.findByUsernameSafe(username) == null) {
            appUserService.createUser(username, password, role);
        }
    }

    private void createIfMissing(EducationLevel level, String name, String abbreviation, int position) {
        if (subjectRepo.findByNameAndEducationLevel(name, level).isEmpty()) {
            subjectRepo.save(subject(level, name, abbreviation, position, false));
        }
    }

    private void createCompositeIfMissing(EducationLevel level, String name, String abbreviation, int position,
                                          SubjectComponentEntity... components) {
        if (subjectRepo.findByNameAndEducationLevel(name, level).isEmpty()) {
            SubjectEntity s = subject(level, name, abbreviation, position, true);
            for (SubjectComponentEntity c : components) {
                s.addComponent(c);
            }
            subjectRepo.save(s);
        }
    }

    private static SubjectEntity subject(EducationLevel level, String name, String abbreviation, int position, boolean composite) {
        return SubjectEntity.builder()
                .name(name)
                .abbreviation(abbreviation)
                .educationLevel(level)
                .position(position)
                .composite(composite)
                .build();
    }

    private static SubjectComponentEntity component(String name, String abbreviation, double weight, double maxRawScore) {
        SubjectComponentEntity c = new SubjectComponentEntity();
        c.setName(name);
        c.setAbbreviation(abbreviation);
        c.setWeight(weight);
        c.setMaxRawScore(maxRawScore);
        return c;
    }
}

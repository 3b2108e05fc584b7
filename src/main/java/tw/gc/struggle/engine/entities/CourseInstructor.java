package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which instructor receives alerts for a course.
 */
@Entity
@Table(name = "course_instructors", uniqueConstraints = {
    @UniqueConstraint(name = "uk_course_instructor", columnNames = {"tenant_id", "course_id", "instructor_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseInstructor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "course_id", nullable = false, length = 64)
    private String courseId;

    @Column(name = "instructor_id", nullable = false, length = 128)
    private String instructorId;

    @Column(name = "primary_instructor", nullable = false)
    @Builder.Default
    private boolean primaryInstructor = true;
}

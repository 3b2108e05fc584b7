package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.CourseInstructor;

import java.util.List;

@Repository
public interface CourseInstructorRepository extends JpaRepository<CourseInstructor, Long> {

    List<CourseInstructor> findByTenantIdAndCourseIdOrderByPrimaryInstructorDesc(String tenantId, String courseId);
}

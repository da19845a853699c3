package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.TrackedCollaborator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrackedCollaboratorRepository extends JpaRepository<TrackedCollaborator, Long> {

    /** 統計範圍內的使用者名稱；空清單代表全部列入 */
    @Query("SELECT c.userName FROM TrackedCollaborator t JOIN Collaborator c ON c.id = t.collaboratorId WHERE t.repositoryId = :repositoryId")
    List<String> findTrackedUserNames(@Param("repositoryId") Long repositoryId);

    @Modifying
    @Query("DELETE FROM TrackedCollaborator t WHERE t.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}

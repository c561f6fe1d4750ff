package com.groceryshopper.chat.repository;

import com.groceryshopper.chat.domain.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByUsername(String username);

    /**
     * Update the stored generation backend preference
     */
    @Modifying
    @Transactional
    @Query("UPDATE UserAccount u SET u.preferredLlmModel = :model WHERE u.id = :userId")
    int updatePreferredModel(@Param("userId") Long userId, @Param("model") String model);
}

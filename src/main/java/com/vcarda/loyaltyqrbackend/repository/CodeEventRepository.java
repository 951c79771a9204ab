package com.vcarda.loyaltyqrbackend.repository;

import com.vcarda.loyaltyqrbackend.entity.CodeEvent;
import com.vcarda.loyaltyqrbackend.entity.CodeEventType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CodeEventRepository extends JpaRepository<CodeEvent, Long> {

    List<CodeEvent> findByCodeIdOrderByIdAsc(Long codeId);

    long countByCodeIdAndEventType(Long codeId, CodeEventType eventType);
}

package com.phonos.commerce.repository;

import com.phonos.commerce.model.WebDealResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface WebDealResultRepository extends JpaRepository<WebDealResult, UUID> {
}

package com.workledger.api.repository;

import com.workledger.api.model.PtoRequest;
import com.workledger.api.model.enums.PtoStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PtoRequestRepository extends JpaRepository<PtoRequest, Long> {

    List<PtoRequest> findByStatus(PtoStatus status);
}

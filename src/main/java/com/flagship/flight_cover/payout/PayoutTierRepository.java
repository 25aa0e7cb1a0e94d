package com.flagship.flight_cover.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PayoutTierRepository extends JpaRepository<PayoutTierEntity, Long> {

    List<PayoutTierEntity> findAllByOrderByIdAsc();
}

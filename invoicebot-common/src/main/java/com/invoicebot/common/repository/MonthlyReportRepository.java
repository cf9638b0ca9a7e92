package com.invoicebot.common.repository;

import com.invoicebot.common.entity.MonthlyReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MonthlyReportRepository extends JpaRepository<MonthlyReport, Long> {

    boolean existsByYearAndMonth(int year, int month);
}

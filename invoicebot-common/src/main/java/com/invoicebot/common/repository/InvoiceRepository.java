package com.invoicebot.common.repository;

import com.invoicebot.common.entity.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    // Report input: invoice date first, received date when the classifier found none
    @Query("SELECT i FROM Invoice i WHERE i.year = :year AND i.month = :month AND i.reported = false " +
            "ORDER BY COALESCE(i.invoiceDate, i.receivedDate) ASC, i.id ASC")
    List<Invoice> findUnreported(@Param("year") int year, @Param("month") int month);

    List<Invoice> findByEmailId(String emailId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Invoice i SET i.reported = true WHERE i.id IN :ids")
    int markReported(@Param("ids") Collection<Long> ids);
}

package com.ospicorp.geosimple.company;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Integer> {

  @Query(value = "SELECT nextval(pg_get_serial_sequence('company', 'id'))", nativeQuery = true)
  long nextId();
}

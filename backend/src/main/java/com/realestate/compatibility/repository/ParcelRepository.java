package com.realestate.compatibility.repository;

import com.realestate.compatibility.model.Parcel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParcelRepository extends JpaRepository<Parcel, Integer> {

    @Query("SELECT p FROM Parcel p WHERE p.geom IS NOT NULL ORDER BY p.id")
    List<Parcel> findAllWithGeometry();
}

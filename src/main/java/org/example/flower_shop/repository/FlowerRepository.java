package org.example.flower_shop.repository;

import org.example.flower_shop.model.Flower;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FlowerRepository extends JpaRepository<Flower, Long> {

    //Каталог для покупателя — только то, что в наличии:
    List<Flower> findByAvailableTrueOrderByIdAsc();

    //Весь список для админки:
    List<Flower> findAllByOrderByIdAsc();
}

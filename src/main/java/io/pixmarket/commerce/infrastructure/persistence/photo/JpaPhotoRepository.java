package io.pixmarket.commerce.infrastructure.persistence.photo;

import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaPhotoRepository extends JpaRepository<Photo, Long>, PhotoRepository {

    // Explicitly declare methods to resolve ambiguity with PhotoRepository
    @Override
    Optional<Photo> findById(Long id);

    @Override
    List<Photo> findAllById(Iterable<Long> ids);

    @Override
    Photo save(Photo photo);

    @Override
    long count();
}

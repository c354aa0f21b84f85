package io.pixmarket.commerce.domain.photo;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

/**
 * 카탈로그 조회 포트 ({@code get_price(item_id) -> price | NotFound})
 */
public interface PhotoRepository {

    Optional<Photo> findById(Long id);

    List<Photo> findAllById(Iterable<Long> ids);

    Photo save(Photo photo);

    long count();

    default Photo findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PHOTO_NOT_FOUND,
                "사진을 찾을 수 없습니다. photoId: " + id
            ));
    }
}

package com.rental.marketplace.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.io.Serializable;
import java.util.List;
import java.util.function.Function;

/**
 * One page of results; pages are 1-based.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageDTO<T> implements Serializable {

    private List<T> docs;
    private Long totalDocs;
    private Integer limit;
    private Integer page;
    private Integer totalPages;
    private Boolean hasNextPage;
    private Boolean hasPrevPage;

    public static <E, T> PageDTO<T> of(Page<E> page, Function<E, T> mapper) {
        return new PageDTO<>(
                page.getContent().stream().map(mapper).toList(),
                page.getTotalElements(),
                page.getSize(),
                page.getNumber() + 1,
                page.getTotalPages(),
                page.hasNext(),
                page.hasPrevious());
    }
}

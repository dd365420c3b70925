package com.volunteermedia.repository;

import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.CommentTag;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.Collection;

/**
 * Composable filters over {@link AnimalComment}. Each returns {@code null} when its
 * argument is absent, which {@link Specification#where} treats as "no restriction".
 */
public final class CommentSpecifications {

    private CommentSpecifications() {
    }

    public static Specification<AnimalComment> active() {
        return (root, query, cb) -> cb.isNull(root.get("deletedAt"));
    }

    public static Specification<AnimalComment> inGroup(Long groupId) {
        if (groupId == null) {
            return null;
        }
        return (root, query, cb) -> {
            Subquery<Long> animals = query.subquery(Long.class);
            Root<Animal> animal = animals.from(Animal.class);
            animals.select(animal.get("id"))
                    .where(cb.equal(animal.get("groupId"), groupId), cb.isNull(animal.get("deletedAt")));
            return root.get("animalId").in(animals);
        };
    }

    public static Specification<AnimalComment> forAnimal(Long animalId) {
        if (animalId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("animalId"), animalId);
    }

    public static Specification<AnimalComment> taggedWithAny(Collection<String> tagNames) {
        if (tagNames == null || tagNames.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> {
            Subquery<Long> tagged = query.subquery(Long.class);
            Root<AnimalComment> inner = tagged.from(AnimalComment.class);
            Join<AnimalComment, CommentTag> tag = inner.join("tags");
            tagged.select(inner.get("id")).where(tag.get("name").in(tagNames));
            return root.get("id").in(tagged);
        };
    }

    public static Specification<AnimalComment> withRating(Integer rating) {
        if (rating == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("sessionRating"), rating);
    }

    public static Specification<AnimalComment> withRatingBetween(int min, int max) {
        return (root, query, cb) -> cb.between(root.get("sessionRating"), min, max);
    }

    public static Specification<AnimalComment> createdFrom(Instant from) {
        if (from == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    public static Specification<AnimalComment> createdTo(Instant to) {
        if (to == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("createdAt"), to);
    }
}

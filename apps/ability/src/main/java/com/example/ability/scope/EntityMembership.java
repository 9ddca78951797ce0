package com.example.ability.scope;

import com.example.ability.model.Entity;
import com.example.ability.model.User;
import com.example.ability.rule.RuleContext;
import com.example.ability.rule.SubjectView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Entity membership predicates.
 *
 * <ul>
 *   <li>direct: the subject belongs to the user's own entity</li>
 *   <li>sub-entities: the user's entity or one of its direct children</li>
 *   <li>entity tree: the user's entity or any descendant</li>
 * </ul>
 *
 * <p>The direct check always runs first and short-circuits the tree walk.
 * A user without an entity belongs nowhere.</p>
 */
@Slf4j
@RequiredArgsConstructor
class EntityMembership {

    private static final int SUB_ENTITY_DEPTH = 1;

    private final SubjectKindResolver subjectKinds;

    boolean belongsToEntity(User user, SubjectView subject, RuleContext rule) {
        SubjectKind kind = subjectKinds.resolve(rule.subject());
        Entity userEntity = user.getEntity();
        if (userEntity == null) {
            log.debug("User {} has no entity, {} membership denied", user.getId(), rule.subject());
            return false;
        }
        return kind.entityIds(subject).contains(userEntity.id());
    }

    boolean belongsToSubEntities(User user, SubjectView subject, RuleContext rule) {
        return belongsWithin(user, subject, rule, SUB_ENTITY_DEPTH);
    }

    boolean belongsToEntityTree(User user, SubjectView subject, RuleContext rule) {
        return belongsWithin(user, subject, rule, EntityTreeWalker.UNBOUNDED);
    }

    private boolean belongsWithin(User user, SubjectView subject, RuleContext rule, int maxDepth) {
        if (belongsToEntity(user, subject, rule)) {
            return true;
        }
        Entity userEntity = user.getEntity();
        if (userEntity == null) {
            return false;
        }

        Set<String> userEntityIds = EntityTreeWalker.collectIds(userEntity, maxDepth);
        List<String> subjectEntityIds = subjectKinds.resolve(rule.subject()).entityIds(subject);
        log.debug("Checking {} {} against entities {}", rule.subject(), subjectEntityIds, userEntityIds);
        return subjectEntityIds.stream().anyMatch(userEntityIds::contains);
    }
}

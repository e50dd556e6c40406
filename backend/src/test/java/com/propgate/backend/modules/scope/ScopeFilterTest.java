package com.propgate.backend.modules.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;

import com.propgate.backend.modules.scope.application.ScopeFilter;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;
import com.propgate.backend.modules.scope.application.ScopeResolver;
import com.propgate.backend.modules.scope.domain.CreatorOwned;
import com.propgate.backend.modules.scope.domain.ResolvedScope;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScopeFilterTest {

    @Mock
    private ScopeResolver scopeResolver;

    private ScopeFilter scopeFilter;

    private final Row r1 = new Row(1L, 7L);
    private final Row r2 = new Row(2L, 8L);
    private final Row r3 = new Row(3L, 7L);
    private final Row orphan = new Row(4L, null);

    @BeforeEach
    void setUp() {
        scopeFilter = new ScopeFilter(scopeResolver);
    }

    @Test
    @DisplayName("OWN 범위는 본인이 만든 행만 남긴다")
    void ownScopeKeepsOwnRows() {
        when(scopeResolver.resolveScope(eq(7L), any(ScopeResolutionContext.class))).thenReturn(ResolvedScope.own(7L));

        List<Row> visible = scopeFilter.applyScope(List.of(r1, r2, r3, orphan), 7L);

        assertThat(visible).containsExactly(r1, r3);
    }

    @Test
    @DisplayName("PM 범위는 생태계 구성원이 만든 행을 남긴다")
    void pmScopeKeepsEcosystemRows() {
        when(scopeResolver.resolveScope(eq(9L), any(ScopeResolutionContext.class)))
                .thenReturn(ResolvedScope.pm(9L, Set.of(8L, 9L)));

        assertThat(scopeFilter.applyScope(List.of(r1, r2, r3), 9L)).containsExactly(r2);
        assertThat(scopeFilter.hasAccess(r2, 9L)).isTrue();
        assertThat(scopeFilter.hasAccess(r1, 9L)).isFalse();
    }

    @Test
    @DisplayName("ALL 범위는 필터링하지 않고 조건절도 필요 없다")
    void allScopeKeepsEverything() {
        ScopeResolutionContext context = new ScopeResolutionContext();
        when(scopeResolver.resolveScope(1L, context)).thenReturn(ResolvedScope.all(1L));

        assertThat(scopeFilter.applyScope(List.of(r1, r2, orphan), 1L, context)).containsExactly(r1, r2, orphan);
        assertThat(scopeFilter.creatorRestriction(1L, context)).isEmpty();
    }

    @Test
    @DisplayName("알 수 없는 사용자는 어떤 행에도 접근하지 못한다")
    void unknownUserSeesNothing() {
        when(scopeResolver.resolveScope(eq(404L), any(ScopeResolutionContext.class))).thenReturn(ResolvedScope.none(404L));

        assertThat(scopeFilter.applyScope(List.of(r1, r2), 404L)).isEmpty();
        assertThat(scopeFilter.hasAccess(r1, 404L)).isFalse();
    }

    @Test
    @DisplayName("빈 컬렉션은 범위 조회 없이 그대로 비어 있다")
    void emptyInputShortCircuits() {
        assertThat(scopeFilter.applyScope(List.<Row>of(), 7L)).isEmpty();
        assertThat(scopeFilter.hasAccess(null, 7L)).isFalse();
    }

    private record Row(Long id, Long createdBy) implements CreatorOwned {

        @Override
        public Long getCreatedBy() {
            return createdBy;
        }
    }
}

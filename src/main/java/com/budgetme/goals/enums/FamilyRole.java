package com.budgetme.goals.enums;

/**
 * Papel do usuário dentro de uma família.
 * Não tem relação com {@link Role} (papel no sistema).
 */
public enum FamilyRole {
    ADMIN(true),
    MEMBER(true),
    VIEWER(false);

    private final boolean contributionRights;

    FamilyRole(boolean contributionRights) {
        this.contributionRights = contributionRights;
    }

    public boolean hasContributionRights() {
        return contributionRights;
    }
}

package com.budgetme.goals.services.contributions.orchestrator;

@FunctionalInterface
public interface ContributionSuccessListener {

    void onContributionSuccess(ContributionSuccess success);
}

package io.github.budgetcore.domain;

import io.github.budgetcore.base_exceptions.RepositoryException;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Persistence collaborator of the core. Implementations live outside this library.
 */
public interface BudgetRepository {

    @NotNull List<IncomeSource> listIncomeSources(long userId, @NotNull YearMonth period) throws RepositoryException;

    @NotNull List<BudgetSource> listBudgetSources(long userId, @NotNull YearMonth period) throws RepositoryException;

    @NotNull List<Expense> listExpenses(@NotNull YearMonth period) throws RepositoryException;

    /**
     * @return the stored expense carrying its assigned id
     */
    @NotNull Expense addExpense(@NotNull Expense draft) throws RepositoryException;

    @NotNull Expense updateExpense(@NotNull Expense expense) throws RepositoryException;

    void deleteExpense(long expenseId) throws RepositoryException;

    @NotNull IncomeSource createIncomeSource(long userId, @NotNull String name, @NotNull YearMonth period,
                                             long amountCents) throws RepositoryException;

    @NotNull IncomeSource updateIncomeSource(long id, @NotNull String name, long amountCents) throws RepositoryException;

    @NotNull BudgetSource createBudgetSource(long userId, @NotNull String name, @NotNull YearMonth period,
                                             long amountCents) throws RepositoryException;

    @NotNull BudgetSource updateBudgetSource(long id, @NotNull String name, long amountCents) throws RepositoryException;
}

package io.calcshell.core.finance;

/** Loan amortization and compound interest formulas. */
public final class FinanceCalculator {

  /** Default compounding frequency: monthly. */
  public static final int MONTHLY = 12;

  private FinanceCalculator() {}

  /**
   * Fixed monthly payment of an amortized loan.
   *
   * @param principal amount borrowed
   * @param annualRate yearly interest rate as a fraction ({@code 0.05} for 5%)
   * @param years loan term
   * @return the monthly payment
   * @throws IllegalArgumentException if the term is not positive or an input is negative
   */
  public static double loanPayment(double principal, double annualRate, int years) {
    requireNonNegative(principal, "principal");
    requireNonNegative(annualRate, "rate");
    if (years <= 0) {
      throw new IllegalArgumentException("years must be positive: " + years);
    }
    double monthlyRate = annualRate / MONTHLY;
    double months = (double) years * MONTHLY;
    if (monthlyRate == 0) {
      return principal / months;
    }
    double growth = Math.pow(1 + monthlyRate, months);
    if (Double.isInfinite(growth)) {
      // the amortization factor tends to the interest-only payment
      return principal * monthlyRate;
    }
    return principal * (monthlyRate * growth) / (growth - 1);
  }

  /**
   * Final balance after compounding.
   *
   * @param principal starting amount
   * @param rate yearly interest rate as a fraction
   * @param years duration
   * @param periodsPerYear compounding periods per year
   * @return principal plus accumulated interest
   */
  public static double compoundInterest(
      double principal, double rate, int years, int periodsPerYear) {
    requireNonNegative(principal, "principal");
    if (years < 0) {
      throw new IllegalArgumentException("years must not be negative: " + years);
    }
    if (periodsPerYear <= 0) {
      throw new IllegalArgumentException("periods per year must be positive: " + periodsPerYear);
    }
    return principal * Math.pow(1 + rate / periodsPerYear, (double) periodsPerYear * years);
  }

  public static double compoundInterest(double principal, double rate, int years) {
    return compoundInterest(principal, rate, years, MONTHLY);
  }

  private static void requireNonNegative(double value, String what) {
    if (value < 0 || Double.isNaN(value)) {
      throw new IllegalArgumentException(what + " must not be negative: " + value);
    }
  }
}

package com.verlumen.formuladiscovery.features;

import com.google.auto.value.AutoValue;
import java.time.LocalDate;

/**
 * One supervised example: the inputs observed for a security on {@link #date()} and the return
 * realized by {@link #targetDate()}.
 */
@AutoValue
public abstract class TrainingExample {
  public static TrainingExample create(
      String symbol,
      LocalDate date,
      LocalDate targetDate,
      TrainingInputs inputs,
      double targetReturn) {
    return new AutoValue_TrainingExample(symbol, date, targetDate, inputs, targetReturn);
  }

  public abstract String symbol();

  public abstract LocalDate date();

  public abstract LocalDate targetDate();

  public abstract TrainingInputs inputs();

  public abstract double targetReturn();

  public TrainingExample withInputs(TrainingInputs inputs) {
    return create(symbol(), date(), targetDate(), inputs, targetReturn());
  }
}

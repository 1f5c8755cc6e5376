package com.namekis.gitfleet.risk;

import java.nio.file.Path;

public interface RiskCollector {
  RiskSnapshot collect(Path repo);
}

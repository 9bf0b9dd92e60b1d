package com.ltlplan.model;

public enum Player {
  SYSTEM, ENVIRONMENT
}

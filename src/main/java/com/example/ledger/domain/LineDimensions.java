package com.example.ledger.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/** Optional analysis tags carried by a journal line. */
@Embeddable
public class LineDimensions {

  @Column(name = "department", length = 50)
  private String department;

  @Column(name = "project", length = 50)
  private String project;

  @Column(name = "cost_center", length = 50)
  private String costCenter;

  public LineDimensions() {}

  public LineDimensions(String department, String project, String costCenter) {
    this.department = department;
    this.project = project;
    this.costCenter = costCenter;
  }

  public LineDimensions copy() {
    return new LineDimensions(department, project, costCenter);
  }

  public String getDepartment() {
    return department;
  }

  public String getProject() {
    return project;
  }

  public String getCostCenter() {
    return costCenter;
  }
}

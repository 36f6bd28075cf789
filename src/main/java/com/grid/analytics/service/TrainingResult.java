package com.grid.analytics.service;

import com.grid.analytics.model.EvaluationReport;
import com.grid.analytics.model.TrainedModel;

import java.util.List;

public record TrainingResult(List<TrainedModel> models, EvaluationReport report) {}

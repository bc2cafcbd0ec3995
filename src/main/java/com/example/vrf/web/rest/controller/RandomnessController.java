package com.example.vrf.web.rest.controller;

import com.example.vrf.domain.entity.RandomnessRequest;
import com.example.vrf.service.RandomnessPipeline;
import com.example.vrf.web.rest.request.DiceRequest;
import com.example.vrf.web.rest.request.ItemsRequest;
import com.example.vrf.web.rest.request.NumberRequest;
import com.example.vrf.web.rest.request.RandomnessBody;
import com.example.vrf.web.rest.request.WinnersRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Randomness endpoints. Access control, attestation and settlement happen in
 * {@link RandomnessPipeline}.
 */
@RestController
@RequiredArgsConstructor
public class RandomnessController implements RandomnessAPI {

  private static final RandomnessBody EMPTY_BODY = new RandomnessBody(null, null);

  private final RandomnessPipeline pipeline;

  @Override
  public ResponseEntity<Map<String, Object>> randomness(RandomnessBody body,
                                                        HttpServletRequest request) {
    RandomnessBody effective = body != null ? body : EMPTY_BODY;
    return run(RandomnessRequest.randomness(effective.requestHash(), effective.metadata()), request);
  }

  @Override
  public ResponseEntity<Map<String, Object>> number(NumberRequest body, HttpServletRequest request) {
    return run(RandomnessRequest.number(body.min(), body.max(), body.requestHash(), body.metadata()),
               request);
  }

  @Override
  public ResponseEntity<Map<String, Object>> dice(DiceRequest body, HttpServletRequest request) {
    return run(RandomnessRequest.dice(body.dice(), body.requestHash(), body.metadata()), request);
  }

  @Override
  public ResponseEntity<Map<String, Object>> pick(ItemsRequest body, HttpServletRequest request) {
    return run(RandomnessRequest.pick(body.items(), body.requestHash(), body.metadata()), request);
  }

  @Override
  public ResponseEntity<Map<String, Object>> shuffle(ItemsRequest body, HttpServletRequest request) {
    return run(RandomnessRequest.shuffle(body.items(), body.requestHash(), body.metadata()), request);
  }

  @Override
  public ResponseEntity<Map<String, Object>> winners(WinnersRequest body,
                                                     HttpServletRequest request) {
    return run(RandomnessRequest.winners(body.items(), body.count(), body.requestHash(),
                                         body.metadata()), request);
  }

  @Override
  public ResponseEntity<Map<String, Object>> uuid(RandomnessBody body, HttpServletRequest request) {
    RandomnessBody effective = body != null ? body : EMPTY_BODY;
    return run(RandomnessRequest.uuid(effective.requestHash(), effective.metadata()), request);
  }

  private ResponseEntity<Map<String, Object>> run(RandomnessRequest randomnessRequest,
                                                  HttpServletRequest request) {
    return ResponseEntity.ok(pipeline.execute(randomnessRequest, request));
  }
}

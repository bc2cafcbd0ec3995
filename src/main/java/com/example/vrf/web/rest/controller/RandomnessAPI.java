package com.example.vrf.web.rest.controller;

import static com.example.vrf.web.rest.ApiConstants.ApiPath.*;

import com.example.vrf.web.rest.request.DiceRequest;
import com.example.vrf.web.rest.request.ItemsRequest;
import com.example.vrf.web.rest.request.NumberRequest;
import com.example.vrf.web.rest.request.RandomnessBody;
import com.example.vrf.web.rest.request.WinnersRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.Parameters;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Randomness",
    description = "Attested randomness. Requires an API key, an allow-listed origin or an x402 payment."
)
@RequestMapping(
    value = V1_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
@ApiResponses(value = {
    @ApiResponse(responseCode = "400", description = "Invalid parameters"),
    @ApiResponse(responseCode = "402", description = "Payment required, invalid or replayed"),
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded"),
    @ApiResponse(responseCode = "500", description = "Attestation unavailable or internal error")
})
public interface RandomnessAPI {

  @Operation(
      summary = "Raw 256-bit seed",
      description = "Returns 32 random bytes as hex together with their attestation"
  )
  @ApiResponse(responseCode = "200", description = "Seed generated")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOMNESS)
  ResponseEntity<Map<String, Object>> randomness(
      @RequestBody(required = false) RandomnessBody body, HttpServletRequest request);

  @Operation(
      summary = "Random number in range",
      description = "Integer in [min, max]; min defaults to 1, max - min may not exceed 1e9"
  )
  @ApiResponse(responseCode = "200", description = "Number generated")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOM_BASE + NUMBER)
  ResponseEntity<Map<String, Object>> number(@RequestBody NumberRequest body,
                                             HttpServletRequest request);

  @Operation(
      summary = "Roll dice",
      description = "NdM notation with 1-100 dice of 2-1000 sides"
  )
  @ApiResponse(responseCode = "200", description = "Dice rolled")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOM_BASE + DICE)
  ResponseEntity<Map<String, Object>> dice(@RequestBody DiceRequest body,
                                           HttpServletRequest request);

  @Operation(
      summary = "Pick one item",
      description = "Uniformly picks one of up to 100,000 items"
  )
  @ApiResponse(responseCode = "200", description = "Item picked")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOM_BASE + PICK)
  ResponseEntity<Map<String, Object>> pick(@RequestBody ItemsRequest body,
                                           HttpServletRequest request);

  @Operation(
      summary = "Shuffle a list",
      description = "Fisher-Yates shuffle of up to 1,000 items"
  )
  @ApiResponse(responseCode = "200", description = "List shuffled")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOM_BASE + SHUFFLE)
  ResponseEntity<Map<String, Object>> shuffle(@RequestBody ItemsRequest body,
                                              HttpServletRequest request);

  @Operation(
      summary = "Pick distinct winners",
      description = "Selects count distinct items (default 1) from up to 100,000"
  )
  @ApiResponse(responseCode = "200", description = "Winners selected")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOM_BASE + WINNERS)
  ResponseEntity<Map<String, Object>> winners(@RequestBody WinnersRequest body,
                                              HttpServletRequest request);

  @Operation(summary = "Random UUIDv4")
  @ApiResponse(responseCode = "200", description = "UUID generated")
  @Parameters({
      @Parameter(name = "PAYMENT-SIGNATURE", in = ParameterIn.HEADER,
          description = "Base64 JSON x402 payment payload (X-Payment also accepted)"),
      @Parameter(name = "X-API-Key", in = ParameterIn.HEADER, description = "Free-tier API key")
  })
  @PostMapping(value = RANDOM_BASE + UUID)
  ResponseEntity<Map<String, Object>> uuid(
      @RequestBody(required = false) RandomnessBody body, HttpServletRequest request);
}

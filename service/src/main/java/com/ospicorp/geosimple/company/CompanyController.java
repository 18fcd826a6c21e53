package com.ospicorp.geosimple.company;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/companies")
@Tag(name = "Companies")
public class CompanyController {

  private final CompanyService service;

  public CompanyController(CompanyService service) {
    this.service = service;
  }

  @PostMapping
  @Operation(summary = "Insert a company",
      description = "Stores a company. The geom field is always derived from latitude and longitude.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Stored company",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CompanyDto.class))),
      @ApiResponse(responseCode = "400", description = "Missing required field",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Duplicate id",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Invalid coordinate",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<CompanyDto> insert(@RequestBody CompanyRequest request) {
    Company stored = service.insert(request.toCompany());
    return ResponseEntity.created(URI.create("/v1/companies/" + stored.getId()))
        .body(CompanyDto.from(stored));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get a company", description = "Fetch a single company with its derived geometry.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Company",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CompanyDto.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompanyDto select(@PathVariable @Parameter(description = "Company identifier",
      example = "10001") int id) {
    return CompanyDto.from(service.select(id));
  }

  @PutMapping("/{id}")
  @Operation(summary = "Update a company",
      description = "Replaces name and coordinates and derives the geometry again.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Updated company",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CompanyDto.class))),
      @ApiResponse(responseCode = "400", description = "Missing required field",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Integrity violation",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Invalid coordinate",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompanyDto update(@PathVariable @Parameter(description = "Company identifier") int id,
      @RequestBody CompanyRequest request) {
    return CompanyDto.from(service.update(id, request.toCompany()));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a company")
  @ApiResponses({
      @ApiResponse(responseCode = "204", description = "Deleted"),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Void> delete(@PathVariable @Parameter(description = "Company identifier") int id) {
    service.delete(id);
    return ResponseEntity.noContent().build();
  }
}

package com.medassist.fhir;

import java.util.ArrayList;
import java.util.List;

import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import ca.uhn.fhir.rest.client.api.IGenericClient;
import ca.uhn.fhir.rest.server.exceptions.ResourceGoneException;
import ca.uhn.fhir.rest.server.exceptions.ResourceNotFoundException;

import com.medassist.exception.ProfileNotFoundException;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.model.RawPatientFacts;
import com.medassist.source.PatientFactSource;

/**
 * EHR patient facts over FHIR R4:
 * - Patient demographics
 * - Vital signs and glycemic labs (Observations, by LOINC code)
 * - Active Conditions
 * - Active MedicationStatements
 */
@Component
@Order(2)
@ConditionalOnProperty(prefix = "medassist.fhir", name = "enabled", havingValue = "true")
public class FhirPatientFactSource implements PatientFactSource {

    private static final Logger log = LoggerFactory.getLogger(FhirPatientFactSource.class);

    public static final String NAME = "fhir";

    private static final int OBSERVATION_PAGE_SIZE = 100;

    private final IGenericClient fhirClient;
    private final FhirFactMapper mapper;

    public FhirPatientFactSource(IGenericClient ehrFhirClient, FhirFactMapper mapper) {
        this.fhirClient = ehrFhirClient;
        this.mapper = mapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RawPatientFacts fetchPatientFacts(String patientId) {
        Patient patient = readPatient(patientId);
        try {
            List<Observation> observations = getObservations(patientId);
            List<Condition> conditions = getConditions(patientId);
            List<MedicationStatement> statements = getMedicationStatements(patientId);

            log.debug("FHIR facts for {}: {} observations, {} conditions, {} medication statements",
                    patientId, observations.size(), conditions.size(), statements.size());
            return mapper.toFacts(NAME, patient, observations, conditions, statements);

        } catch (RuntimeException e) {
            log.error("Error fetching FHIR resources for patient {}: {}", patientId, e.getMessage());
            throw new SourceUnavailableException(NAME, e.getMessage(), e);
        }
    }

    private Patient readPatient(String patientId) {
        try {
            return fhirClient.read()
                    .resource(Patient.class)
                    .withId(patientId)
                    .execute();
        } catch (ResourceNotFoundException | ResourceGoneException e) {
            throw new ProfileNotFoundException(patientId);
        } catch (RuntimeException e) {
            log.error("Error fetching patient {}: {}", patientId, e.getMessage());
            throw new SourceUnavailableException(NAME, e.getMessage(), e);
        }
    }

    List<Observation> getObservations(String patientId) {
        Bundle results = fhirClient.search()
                .forResource(Observation.class)
                .where(Observation.PATIENT.hasId(patientId))
                .and(Observation.CODE.exactly().codes(FhirFactMapper.OBSERVATION_CODES))
                .sort().descending(Observation.DATE)
                .count(OBSERVATION_PAGE_SIZE)
                .returnBundle(Bundle.class)
                .execute();
        return entries(results, Observation.class);
    }

    List<Condition> getConditions(String patientId) {
        Bundle results = fhirClient.search()
                .forResource(Condition.class)
                .where(Condition.PATIENT.hasId(patientId))
                .returnBundle(Bundle.class)
                .execute();
        return entries(results, Condition.class);
    }

    List<MedicationStatement> getMedicationStatements(String patientId) {
        Bundle results = fhirClient.search()
                .forResource(MedicationStatement.class)
                .where(MedicationStatement.PATIENT.hasId(patientId))
                .returnBundle(Bundle.class)
                .execute();
        return entries(results, MedicationStatement.class);
    }

    private static <T extends Resource> List<T> entries(Bundle bundle, Class<T> type) {
        List<T> resources = new ArrayList<>();
        bundle.getEntry().forEach(entry -> {
            if (type.isInstance(entry.getResource())) {
                resources.add(type.cast(entry.getResource()));
            }
        });
        return resources;
    }
}
